package io.clubone.reminder.mapping;

import static io.clubone.reminder.support.ActionScheduleFixture.absoluteSchedule;
import static io.clubone.reminder.support.ActionScheduleFixture.membershipSchedule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import io.clubone.reminder.dao.MembershipStatusDAO;
import io.clubone.reminder.sql.SqlSelect;
import io.clubone.reminder.vo.ActionSchedule;
import io.clubone.reminder.vo.RecipientPhase;
import io.clubone.reminder.vo.RecipientQuery;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("MembershipActionMapping")
class MembershipActionMappingTest {

	private static final String AUTO_RENEW_ONLY = "e.contribution_recur_id IS NOT NULL";
	private static final String NON_AUTO_RENEW_ONLY = "e.contribution_recur_id IS NULL";

	@Mock
	private MembershipStatusDAO membershipStatusDAO;

	private MembershipActionMapping mapping;

	@BeforeEach
	void setUp() {
		given(membershipStatusDAO.findCurrentOrExpiredStatusIds()).willReturn(List.of(1L, 2L, 3L, 4L));
		mapping = new MembershipActionMapping(membershipStatusDAO);
	}

	private SqlSelect query(ActionSchedule schedule) {
		return mapping.createQuery(schedule, RecipientPhase.RELATION_FIRST, Collections.emptyMap()).getSelect();
	}

	@Nested
	@DisplayName("auto-renew filter")
	class AutoRenewFilterTest {

		@Test
		@DisplayName("2 keeps only memberships with a recurring contribution")
		void autoRenewOnly() {
			assertThat(query(membershipSchedule(List.of("2"), List.of("2"))).getWheres())
					.contains(AUTO_RENEW_ONLY)
					.doesNotContain(NON_AUTO_RENEW_ONLY);
		}

		@Test
		@DisplayName("1 keeps only memberships without a recurring contribution")
		void nonAutoRenewOnly() {
			assertThat(query(membershipSchedule(List.of("2"), List.of("1"))).getWheres())
					.contains(NON_AUTO_RENEW_ONLY)
					.doesNotContain(AUTO_RENEW_ONLY);
		}

		@Test
		@DisplayName("1 and 2 together behave like 2")
		void bothBehaveLikeAutoRenew() {
			SqlSelect both = query(membershipSchedule(List.of("2"), List.of("1", "2")));
			SqlSelect autoRenew = query(membershipSchedule(List.of("2"), List.of("2")));

			assertThat(both).isEqualTo(autoRenew);
		}

		@Test
		@DisplayName("no option or unreadable options apply no restriction")
		void noRestriction() {
			for (List<String> options : List.of(List.<String>of(), List.of("yes", "auto"), List.of("3"))) {
				assertThat(query(membershipSchedule(List.of("2"), options)).getWheres())
						.doesNotContain(AUTO_RENEW_ONLY, NON_AUTO_RENEW_ONLY);
			}
		}

		@Test
		@DisplayName("options are compared as numbers")
		void numericComparison() {
			assertThat(query(membershipSchedule(List.of("2"), List.of(" 2 "))).getWheres()).contains(AUTO_RENEW_ONLY);
			assertThat(query(membershipSchedule(List.of("2"), List.of("1.0"))).getWheres())
					.contains(NON_AUTO_RENEW_ONLY);
		}
	}

	@Nested
	@DisplayName("membership type filter")
	class TypeFilterTest {

		@Test
		@DisplayName("selected types are bound as an IN list")
		void selectedTypes() {
			SqlSelect select = query(membershipSchedule(List.of("2", "5"), List.of()));

			assertThat(select.getWheres()).contains("e.membership_type_id IN (:memberTypeValues)");
			assertThat(select.getParams()).containsEntry("memberTypeValues", List.of(2L, 5L));
		}

		@Test
		@DisplayName("no selected type matches nobody")
		void noTypes() {
			SqlSelect select = query(membershipSchedule(List.of(), List.of()));

			assertThat(select.getWheres()).contains("e.membership_type_id IS NULL");
			assertThat(select.getParams()).doesNotContainKey("memberTypeValues");
		}

		@Test
		@DisplayName("a missing type list is treated as empty")
		void nullTypes() {
			assertThat(query(membershipSchedule(null, null)).getWheres()).contains("e.membership_type_id IS NULL");
		}

		@Test
		@DisplayName("values that are not ids are dropped")
		void nonNumericTypes() {
			SqlSelect select = query(membershipSchedule(Arrays.asList("7", "gold", null, "99999999999999999999"),
					List.of()));

			assertThat(select.getParams()).containsEntry("memberTypeValues", List.of(7L));
		}

		@Test
		@DisplayName("whole-number decimals select the matching type")
		void integralDecimalTypes() {
			SqlSelect select = query(membershipSchedule(List.of("3.0", "4.5", "-2", " 5.00 "), List.of()));

			assertThat(select.getParams()).containsEntry("memberTypeValues", List.of(3L, 5L));
		}
	}

	@Nested
	@DisplayName("always applied filters")
	class CommonFilterTest {

		@Test
		@DisplayName("overrides excluded, permissions checked, statuses restricted, in that order")
		void commonConditions() {
			SqlSelect select = query(membershipSchedule(List.of("2"), List.of()));

			assertThat(select.getFrom()).isEqualTo("membership e");
			assertThat(select.getWheres()).containsSubsequence(
					"( e.is_override IS NULL OR e.is_override = 0 )",
					"NOT ( e.owner_membership_id IS NOT NULL AND rela.id IS NULL AND relb.id IS NULL )",
					"e.status_id IN (:memberStatus)");
			assertThat(select.getParams()).containsEntry("memberStatus", List.of(1L, 2L, 3L, 4L));
		}

		@Test
		@DisplayName("default params must be usable as named placeholders")
		void illegalDefaultParamName() {
			ActionSchedule schedule = membershipSchedule(List.of("2"), List.of());

			assertThatThrownBy(() -> mapping.createQuery(schedule, RecipientPhase.RELATION_FIRST, Map.of("#now", "x")))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("#now");
		}

		@Test
		@DisplayName("permission joins check edit rights in both directions")
		void permissionJoins() {
			SqlSelect fragment = mapping.membershipPermissionsFilter();

			assertThat(fragment.isFragment()).isTrue();
			assertThat(fragment.getJoins()).containsOnlyKeys("cm", "rela", "relb");
			assertThat(fragment.getJoins().get("cm")).startsWith("LEFT JOIN membership cm ");
			assertThat(fragment.getJoins().get("rela")).startsWith("LEFT JOIN relationship rela ");
			assertThat(fragment.getJoins().get("rela")).contains("rela.contact_id_a = e.contact_id",
					"rela.contact_id_b = cm.contact_id", "rela.is_permission_a_b = :editPerm");
			assertThat(fragment.getJoins().get("relb")).contains("relb.contact_id_a = cm.contact_id",
					"relb.contact_id_b = e.contact_id", "relb.is_permission_b_a = :editPerm");
			assertThat(fragment.getParams()).containsEntry("editPerm", 1);
		}

		@Test
		@DisplayName("no current or expired status leaves nobody eligible")
		void noStatuses() {
			given(membershipStatusDAO.findCurrentOrExpiredStatusIds()).willReturn(List.of());

			SqlSelect select = query(membershipSchedule(List.of("2"), List.of()));

			assertThat(select.getWheres()).contains("e.status_id IS NULL");
			assertThat(select.getParams()).doesNotContainKey("memberStatus");
		}

		@Test
		@DisplayName("default params are carried verbatim")
		void defaultParams() {
			RecipientQuery query = mapping.createQuery(membershipSchedule(List.of("2"), List.of()),
					RecipientPhase.ADDL_FIRST, Map.of("casActionScheduleId", 12L, "casNow", "20250101000000"));

			assertThat(query.getSelect().getParams())
					.containsEntry("casActionScheduleId", 12L)
					.containsEntry("casNow", "20250101000000");
		}
	}

	@Nested
	@DisplayName("recipient metadata")
	class RecipientMetadataTest {

		@Test
		@DisplayName("contact and entity come from the membership alias")
		void fields() {
			RecipientQuery query = mapping.createQuery(membershipSchedule(List.of("2"), List.of()),
					RecipientPhase.RELATION_FIRST, Collections.emptyMap());

			assertThat(query.getAddlCheckFrom()).isEqualTo("membership e");
			assertThat(query.getContactIdField()).isEqualTo("e.contact_id");
			assertThat(query.getEntityIdField()).isEqualTo("e.id");
			assertThat(query.getContactTableAlias()).isNull();
			assertThat(query.getDateField()).isEqualTo("e.end_date");
		}

		@ParameterizedTest(name = "{0} -> {1}")
		@CsvSource({
				"membership_join_date, e.join_date",
				"start_date, e.start_date",
				"membership_end_date, e.end_date",
				"e.end_date, e.end_date",
				"renewal_date, e.renewal_date",
				"'', e."
		})
		@DisplayName("date fields resolve onto the membership alias")
		void dateFields(String startActionDate, String expected) {
			assertThat(MembershipActionMapping.resolveDateField(startActionDate)).isEqualTo(expected);
		}

		@Test
		@DisplayName("missing date field still gets the alias")
		void nullDateField() {
			assertThat(MembershipActionMapping.resolveDateField(null)).isEqualTo("e.");
		}
	}

	@Nested
	@DisplayName("schedule behaviour")
	class BehaviourTest {

		@Test
		@DisplayName("absolute dates keep reminder tracking on trigger date change")
		void absoluteDateDoesNotReset() {
			assertThat(mapping.resetOnTriggerDateChange(absoluteSchedule(LocalDate.of(2025, 1, 1)))).isFalse();
		}

		@Test
		@DisplayName("relative dates reset reminder tracking")
		void relativeDateResets() {
			assertThat(mapping.resetOnTriggerDateChange(absoluteSchedule(null))).isTrue();
			assertThat(mapping.resetOnTriggerDateChange(new ActionSchedule())).isTrue();
		}

		@Test
		@DisplayName("additional recipients are always allowed")
		void sendToAdditional() {
			assertThat(mapping.sendToAdditional(101L)).isTrue();
			assertThat(mapping.sendToAdditional(null)).isTrue();
		}

		@Test
		@DisplayName("the same schedule and phase produce equal queries")
		void repeatable() {
			ActionSchedule schedule = membershipSchedule(List.of("2", "5"), List.of("1"));

			RecipientQuery first = mapping.createQuery(schedule, RecipientPhase.RELATION_REPEAT, Map.of("a", 1));
			RecipientQuery second = mapping.createQuery(schedule, RecipientPhase.RELATION_REPEAT, Map.of("a", 1));

			assertThat(first).isEqualTo(second);
			assertThat(first.getSelect().toSql()).isEqualTo(second.getSelect().toSql());
		}
	}

	@Test
	@DisplayName("describes the membership type mapping")
	void descriptor() {
		assertThat(mapping.getId()).isEqualTo(4);
		assertThat(mapping.getDescriptor().getEntity()).isEqualTo("membership");
		assertThat(mapping.getDescriptor().getEntityValueLabel()).isEqualTo("Membership Type");
		assertThat(mapping.getDescriptor().getEntityStatusLabel()).isEqualTo("Auto Renew Options");
		assertThat(mapping.getDateFields()).containsExactly(
				Map.entry("join_date", "Member Since"),
				Map.entry("start_date", "Membership Start Date"),
				Map.entry("end_date", "Membership Expiration Date"));
	}
}
