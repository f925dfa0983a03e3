package io.clubone.reminder.vo;

import java.time.OffsetDateTime;

import io.clubone.reminder.util.RunFrequency;
import lombok.Data;

@Data
public class ScheduledJobDTO {
	private Long id;
	private Long domainId;
	private String name;
	private String description;
	private RunFrequency runFrequency;
	private String apiEntity;
	private String apiAction;
	private String parameters;
	private Boolean isActive;
	private OffsetDateTime lastRun;
}
