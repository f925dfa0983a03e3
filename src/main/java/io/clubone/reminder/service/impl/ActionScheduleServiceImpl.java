package io.clubone.reminder.service.impl;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.clubone.reminder.dao.ActionScheduleDAO;
import io.clubone.reminder.dao.EligibleRecipientDAO;
import io.clubone.reminder.exception.NotValidException;
import io.clubone.reminder.exception.ResourceNotFoundException;
import io.clubone.reminder.mapping.ActionMapping;
import io.clubone.reminder.mapping.ActionMappingRegistry;
import io.clubone.reminder.service.ActionScheduleService;
import io.clubone.reminder.util.ConstantUtility;
import io.clubone.reminder.vo.ActionSchedule;
import io.clubone.reminder.vo.EligibleRecipient;
import io.clubone.reminder.vo.MappingDescriptor;
import io.clubone.reminder.vo.RecipientPhase;
import io.clubone.reminder.vo.RecipientQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class ActionScheduleServiceImpl implements ActionScheduleService {

	private final ActionMappingRegistry actionMappingRegistry;

	private final ActionScheduleDAO actionScheduleDAO;

	private final EligibleRecipientDAO eligibleRecipientDAO;

	@Override
	public List<MappingDescriptor> getMappings() {
		return actionMappingRegistry.getMappings().stream().map(ActionMapping::getDescriptor).toList();
	}

	@Override
	public Map<String, String> getDateFields(int mappingId) {
		return findMapping(mappingId).getDateFields();
	}

	@Override
	@Transactional(readOnly = true)
	public List<EligibleRecipient> previewRecipients(Long actionScheduleId, RecipientPhase phase) {
		ActionSchedule schedule = actionScheduleDAO.findById(actionScheduleId)
				.orElseThrow(() -> new ResourceNotFoundException(ConstantUtility.SCHEDULE_RESOURCE, "id",
						actionScheduleId));
		if (schedule.getMappingId() == null) {
			throw new NotValidException("Action schedule " + actionScheduleId + " has no mapping");
		}
		ActionMapping mapping = findMapping(schedule.getMappingId());
		RecipientQuery query = mapping.createQuery(schedule, phase, Collections.emptyMap());
		List<EligibleRecipient> recipients = eligibleRecipientDAO.findRecipients(query);
		log.info("Action schedule {} ({}) has {} eligible recipient(s) for phase {}", actionScheduleId,
				mapping.getDescriptor().getEntity(), recipients.size(), phase);
		return recipients;
	}

	private ActionMapping findMapping(int mappingId) {
		return actionMappingRegistry.getMapping(mappingId)
				.orElseThrow(() -> new ResourceNotFoundException(ConstantUtility.MAPPING_RESOURCE, "id",
						(long) mappingId));
	}
}
