package io.clubone.reminder.vo;

import java.time.LocalDate;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A scheduled reminder as configured by an administrator. Only the columns the
 * mappings read are carried.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ActionSchedule {
	private Long id;
	private Integer mappingId;
	private String title;
	/** Selected membership type ids; empty when nothing was selected. */
	private List<String> entityValue;
	/** Selected auto-renew options, "1" non-auto-renew and "2" auto-renew. */
	private List<String> entityStatus;
	private String startActionDate;
	private LocalDate absoluteDate;
	private Boolean isActive;
}
