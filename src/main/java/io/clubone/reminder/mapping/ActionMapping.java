package io.clubone.reminder.mapping;

import java.util.Map;

import io.clubone.reminder.vo.ActionSchedule;
import io.clubone.reminder.vo.MappingDescriptor;
import io.clubone.reminder.vo.RecipientPhase;
import io.clubone.reminder.vo.RecipientQuery;

/**
 * Strategy describing which records a scheduled reminder may target and how
 * eligible recipients are selected for it.
 */
public interface ActionMapping {

	int getId();

	MappingDescriptor getDescriptor();

	/**
	 * Date columns a schedule may trigger on, keyed by column name, in display order.
	 */
	Map<String, String> getDateFields();

	/**
	 * Build the query locating recipients that match the schedule.
	 *
	 * @param schedule      the schedule as configured by the administrator
	 * @param phase         stage of recipient resolution being evaluated
	 * @param defaultParams parameters merged verbatim into the query; names must be
	 *                      usable as {@code :name} placeholders
	 *                      ({@code [A-Za-z_][A-Za-z0-9_]*})
	 * @throws IllegalArgumentException if a default parameter name is not a valid
	 *                                  placeholder name
	 */
	RecipientQuery createQuery(ActionSchedule schedule, RecipientPhase phase, Map<String, Object> defaultParams);

	/**
	 * Whether already-sent reminder tracking restarts when the trigger date of a
	 * record changes.
	 */
	boolean resetOnTriggerDateChange(ActionSchedule schedule);

	/**
	 * Whether a schedule of this mapping may also notify additional recipients.
	 */
	boolean sendToAdditional(Long entityId);
}
