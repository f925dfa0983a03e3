package io.clubone.reminder.vo;

/**
 * Stage of recipient resolution the reminder scheduler is evaluating.
 */
public enum RecipientPhase {
	RELATION_FIRST,
	ADDL_FIRST,
	RELATION_REPEAT,
	ADDL_REPEAT
}
