package io.clubone.reminder.service;

import java.util.List;
import java.util.Map;

import io.clubone.reminder.vo.EligibleRecipient;
import io.clubone.reminder.vo.MappingDescriptor;
import io.clubone.reminder.vo.RecipientPhase;

public interface ActionScheduleService {
	List<MappingDescriptor> getMappings();
	Map<String, String> getDateFields(int mappingId);
	List<EligibleRecipient> previewRecipients(Long actionScheduleId, RecipientPhase phase);
}
