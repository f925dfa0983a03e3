package io.clubone.reminder.controller;

import java.util.List;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.clubone.reminder.service.ActionScheduleService;
import io.clubone.reminder.vo.MappingDescriptor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/action-mappings")
@RequiredArgsConstructor
@Tag(name = "Action Mappings", description = "Entities a scheduled reminder can target")
public class ActionMappingController {

	private final ActionScheduleService actionScheduleService;

	@GetMapping
	@Operation(summary = "List registered reminder mappings")
	public List<MappingDescriptor> getMappings() {
		return actionScheduleService.getMappings();
	}

	@GetMapping("/{mappingId}/date-fields")
	@Operation(summary = "Date fields a schedule of the mapping may trigger on")
	public Map<String, String> getDateFields(@PathVariable("mappingId") int mappingId) {
		return actionScheduleService.getDateFields(mappingId);
	}
}
