package io.clubone.reminder.vo;

import java.time.LocalDate;

/**
 * A contact eligible for a reminder, the record that qualified it and the date
 * the reminder is measured from.
 */
public record EligibleRecipient(Long contactId, Long entityId, LocalDate triggerDate) {
}
