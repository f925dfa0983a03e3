package io.clubone.reminder.controller;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.clubone.reminder.service.ActionScheduleService;
import io.clubone.reminder.vo.EligibleRecipient;
import io.clubone.reminder.vo.RecipientPhase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/action-schedules")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Action Schedules", description = "Recipient preview for scheduled reminders")
public class ActionScheduleController {

	private final ActionScheduleService actionScheduleService;

	@GetMapping("/{actionScheduleId}/recipients")
	@Operation(summary = "Preview the recipients currently eligible for a scheduled reminder")
	public List<EligibleRecipient> previewRecipients(@PathVariable("actionScheduleId") Long actionScheduleId,
			@RequestParam(name = "phase", defaultValue = "RELATION_FIRST") RecipientPhase phase) {
		log.debug("inside previewRecipients() scheduleId={} phase={}", actionScheduleId, phase);
		return actionScheduleService.previewRecipients(actionScheduleId, phase);
	}
}
