package io.clubone.reminder.mapping;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import io.clubone.reminder.dao.MembershipStatusDAO;
import io.clubone.reminder.sql.SqlSelect;
import io.clubone.reminder.util.ConstantUtility;
import io.clubone.reminder.util.RelationshipPermission;
import io.clubone.reminder.vo.ActionSchedule;
import io.clubone.reminder.vo.MappingDescriptor;
import io.clubone.reminder.vo.RecipientPhase;
import io.clubone.reminder.vo.RecipientQuery;
import lombok.extern.slf4j.Slf4j;

/**
 * Scheduled reminders for memberships. A schedule targets members by join,
 * start or end date, filtered by membership type and auto-renew option.
 */
@Component
@Slf4j
public class MembershipActionMapping implements ActionMapping {

	/** Matches the legacy mapping id stored on existing schedules. */
	public static final int MEMBERSHIP_TYPE_MAPPING_ID = 4;

	public static final String NON_AUTO_RENEW = "1";

	public static final String AUTO_RENEW = "2";

	private static final String ENTITY_ALIAS = "e";

	private static final String DATE_FIELD_PREFIX = "membership_";

	private static final int MAX_ID_DIGITS = 18;

	private static final MappingDescriptor DESCRIPTOR = MappingDescriptor.builder()
			.id(MEMBERSHIP_TYPE_MAPPING_ID)
			.entity(ConstantUtility.MEMBERSHIP_TABLE)
			.entityLabel("Membership")
			.entityValue("membership_type")
			.entityValueLabel("Membership Type")
			.entityStatus("auto_renew_options")
			.entityStatusLabel("Auto Renew Options")
			.build();

	private static final Map<String, String> DATE_FIELDS;

	static {
		Map<String, String> fields = new LinkedHashMap<>();
		fields.put("join_date", "Member Since");
		fields.put("start_date", "Membership Start Date");
		fields.put("end_date", "Membership Expiration Date");
		DATE_FIELDS = Collections.unmodifiableMap(fields);
	}

	private final MembershipStatusDAO membershipStatusDAO;

	public MembershipActionMapping(MembershipStatusDAO membershipStatusDAO) {
		this.membershipStatusDAO = membershipStatusDAO;
	}

	@EventListener
	public void onRegisterActionMappings(MappingRegisterEvent registrations) {
		registrations.register(this);
	}

	@Override
	public int getId() {
		return MEMBERSHIP_TYPE_MAPPING_ID;
	}

	@Override
	public MappingDescriptor getDescriptor() {
		return DESCRIPTOR;
	}

	@Override
	public Map<String, String> getDateFields() {
		return DATE_FIELDS;
	}

	@Override
	public RecipientQuery createQuery(ActionSchedule schedule, RecipientPhase phase, Map<String, Object> defaultParams) {
		List<String> selectedValues = nonNull(schedule.getEntityValue());
		List<String> selectedStatuses = nonNull(schedule.getEntityStatus());

		SqlSelect.Builder query = SqlSelect.from(ConstantUtility.MEMBERSHIP_TABLE + " " + ENTITY_ALIAS)
				.params(defaultParams);

		// 2 wins over 1 when both are selected
		if (containsOption(selectedStatuses, AUTO_RENEW)) {
			query.where("e.contribution_recur_id IS NOT NULL");
		} else if (containsOption(selectedStatuses, NON_AUTO_RENEW)) {
			query.where("e.contribution_recur_id IS NULL");
		}

		List<Long> typeIds = toIds(selectedValues);
		if (!typeIds.isEmpty()) {
			query.where("e.membership_type_id IN (:memberTypeValues)").param("memberTypeValues", typeIds);
		} else {
			// type is never null, so a schedule without types reaches nobody
			query.where("e.membership_type_id IS NULL");
		}

		query.where("( e.is_override IS NULL OR e.is_override = 0 )");

		query.merge(membershipPermissionsFilter());

		List<Long> statusIds = membershipStatusDAO.findCurrentOrExpiredStatusIds();
		if (statusIds.isEmpty()) {
			log.warn("No current or expired membership statuses defined, schedule {} reaches nobody", schedule.getId());
			query.where("e.status_id IS NULL");
		} else {
			query.where("e.status_id IN (:memberStatus)").param("memberStatus", statusIds);
		}

		RecipientQuery recipientQuery = RecipientQuery.builder()
				.select(query.build())
				.addlCheckFrom(ConstantUtility.MEMBERSHIP_TABLE + " " + ENTITY_ALIAS)
				.contactIdField("e.contact_id")
				.entityIdField("e.id")
				.contactTableAlias(null)
				.dateField(resolveDateField(schedule.getStartActionDate()))
				.build();
		log.debug("Membership reminder query for schedule {} phase {}: {}", schedule.getId(), phase,
				recipientQuery.getSelect().toSql());
		return recipientQuery;
	}

	/**
	 * Excludes inherited memberships unless a relationship grants edit permission
	 * between the member and the owner of the primary membership.
	 */
	SqlSelect membershipPermissionsFilter() {
		Map<String, String> joins = new LinkedHashMap<>();
		joins.put("cm", "LEFT JOIN " + ConstantUtility.MEMBERSHIP_TABLE + " cm ON cm.id = e.owner_membership_id");
		joins.put("rela", "LEFT JOIN " + ConstantUtility.RELATIONSHIP_TABLE + " rela ON rela.contact_id_a = e.contact_id"
				+ " AND rela.contact_id_b = cm.contact_id AND rela.is_permission_a_b = :editPerm");
		joins.put("relb", "LEFT JOIN " + ConstantUtility.RELATIONSHIP_TABLE + " relb ON relb.contact_id_a = cm.contact_id"
				+ " AND relb.contact_id_b = e.contact_id AND relb.is_permission_b_a = :editPerm");
		return SqlSelect.fragment()
				.joins(joins)
				.param("editPerm", RelationshipPermission.EDIT.getCode())
				.where("NOT ( e.owner_membership_id IS NOT NULL AND rela.id IS NULL AND relb.id IS NULL )")
				.build();
	}

	@Override
	public boolean resetOnTriggerDateChange(ActionSchedule schedule) {
		return schedule.getAbsoluteDate() == null;
	}

	@Override
	public boolean sendToAdditional(Long entityId) {
		return true;
	}

	/**
	 * Maps a schedule's start_action_date onto a column of the membership alias.
	 * Legacy values carry a {@code membership_} prefix; names are not validated.
	 */
	static String resolveDateField(String startActionDate) {
		String dateField = StringUtils.replace(StringUtils.defaultString(startActionDate), DATE_FIELD_PREFIX,
				ENTITY_ALIAS + ".");
		if (!dateField.startsWith(ENTITY_ALIAS + ".")) {
			dateField = ENTITY_ALIAS + "." + dateField;
		}
		return dateField;
	}

	private static boolean containsOption(List<String> selected, String option) {
		int wanted = Integer.parseInt(option);
		for (String value : selected) {
			String trimmed = StringUtils.trimToEmpty(value);
			if (NumberUtils.isParsable(trimmed) && Double.parseDouble(trimmed) == wanted) {
				return true;
			}
		}
		return false;
	}

	// ids compare numerically, so "3.0" selects type 3; fractions and text can never match and are dropped
	private static List<Long> toIds(List<String> values) {
		List<Long> ids = new ArrayList<>();
		for (String value : values) {
			String trimmed = StringUtils.trimToEmpty(value);
			if (NumberUtils.isDigits(trimmed)) {
				if (trimmed.length() <= MAX_ID_DIGITS) {
					ids.add(Long.valueOf(trimmed));
				}
			} else if (NumberUtils.isParsable(trimmed)) {
				BigDecimal number = new BigDecimal(trimmed);
				if (number.signum() >= 0 && number.stripTrailingZeros().scale() <= 0
						&& number.precision() - number.scale() <= MAX_ID_DIGITS) {
					ids.add(number.longValueExact());
				}
			}
		}
		return ids;
	}

	private static List<String> nonNull(List<String> values) {
		return values == null ? Collections.emptyList() : values;
	}
}
