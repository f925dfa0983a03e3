package io.clubone.reminder.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.clubone.reminder.dao.ActionScheduleDAO;
import io.clubone.reminder.dao.EligibleRecipientDAO;
import io.clubone.reminder.exception.NotValidException;
import io.clubone.reminder.exception.ResourceNotFoundException;
import io.clubone.reminder.mapping.ActionMapping;
import io.clubone.reminder.mapping.ActionMappingRegistry;
import io.clubone.reminder.sql.SqlSelect;
import io.clubone.reminder.vo.ActionSchedule;
import io.clubone.reminder.vo.EligibleRecipient;
import io.clubone.reminder.vo.MappingDescriptor;
import io.clubone.reminder.vo.RecipientPhase;
import io.clubone.reminder.vo.RecipientQuery;

@ExtendWith(MockitoExtension.class)
@DisplayName("ActionScheduleServiceImpl")
class ActionScheduleServiceImplTest {

	@Mock
	private ActionMappingRegistry actionMappingRegistry;

	@Mock
	private ActionScheduleDAO actionScheduleDAO;

	@Mock
	private EligibleRecipientDAO eligibleRecipientDAO;

	@Mock
	private ActionMapping mapping;

	@InjectMocks
	private ActionScheduleServiceImpl actionScheduleService;

	@Test
	@DisplayName("previews recipients through the schedule's mapping")
	void previewRecipients() {
		ActionSchedule schedule = ActionSchedule.builder().id(1L).mappingId(4).build();
		RecipientQuery query = RecipientQuery.builder().select(SqlSelect.from("membership e").build()).build();
		List<EligibleRecipient> recipients = List.of(new EligibleRecipient(2L, 102L, LocalDate.of(2021, 3, 1)));
		given(actionScheduleDAO.findById(1L)).willReturn(Optional.of(schedule));
		given(actionMappingRegistry.getMapping(4)).willReturn(Optional.of(mapping));
		given(mapping.getDescriptor()).willReturn(MappingDescriptor.builder().id(4).entity("membership").build());
		given(mapping.createQuery(eq(schedule), eq(RecipientPhase.ADDL_FIRST), anyMap())).willReturn(query);
		given(eligibleRecipientDAO.findRecipients(query)).willReturn(recipients);

		assertThat(actionScheduleService.previewRecipients(1L, RecipientPhase.ADDL_FIRST)).isEqualTo(recipients);
	}

	@Test
	@DisplayName("an unknown schedule is not found")
	void unknownSchedule() {
		given(actionScheduleDAO.findById(9L)).willReturn(Optional.empty());

		assertThatThrownBy(() -> actionScheduleService.previewRecipients(9L, RecipientPhase.RELATION_FIRST))
				.isInstanceOf(ResourceNotFoundException.class);
		verify(eligibleRecipientDAO, never()).findRecipients(any());
	}

	@Test
	@DisplayName("a schedule without a mapping is rejected")
	void scheduleWithoutMapping() {
		given(actionScheduleDAO.findById(1L)).willReturn(Optional.of(ActionSchedule.builder().id(1L).build()));

		assertThatThrownBy(() -> actionScheduleService.previewRecipients(1L, RecipientPhase.RELATION_FIRST))
				.isInstanceOf(NotValidException.class);
	}

	@Test
	@DisplayName("a schedule pointing at an unregistered mapping is not found")
	void unregisteredMapping() {
		given(actionScheduleDAO.findById(1L))
				.willReturn(Optional.of(ActionSchedule.builder().id(1L).mappingId(99).build()));
		given(actionMappingRegistry.getMapping(99)).willReturn(Optional.empty());

		assertThatThrownBy(() -> actionScheduleService.previewRecipients(1L, RecipientPhase.RELATION_FIRST))
				.isInstanceOf(ResourceNotFoundException.class)
				.hasMessageContaining("99");
	}

	@Test
	@DisplayName("lists mapping descriptors and date fields")
	void mappingMetadata() {
		MappingDescriptor descriptor = MappingDescriptor.builder().id(4).entity("membership").build();
		given(actionMappingRegistry.getMappings()).willReturn(List.of(mapping));
		given(actionMappingRegistry.getMapping(4)).willReturn(Optional.of(mapping));
		given(mapping.getDescriptor()).willReturn(descriptor);
		given(mapping.getDateFields()).willReturn(Map.of("end_date", "Membership Expiration Date"));

		assertThat(actionScheduleService.getMappings()).containsExactly(descriptor);
		assertThat(actionScheduleService.getDateFields(4)).containsOnlyKeys("end_date");
	}
}
