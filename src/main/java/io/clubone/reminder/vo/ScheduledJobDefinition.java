package io.clubone.reminder.vo;

import io.clubone.reminder.util.RunFrequency;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScheduledJobDefinition {
	String name;
	String description;
	RunFrequency runFrequency;
	String apiEntity;
	String apiAction;
	/** Free-form usage notes shown to administrators, may be null. */
	String parameters;
	boolean active;
}
