package io.clubone.reminder.vo;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MappingDescriptor {
	int id;
	String entity;
	String entityLabel;
	String entityValue;
	String entityValueLabel;
	String entityStatus;
	String entityStatusLabel;
}
