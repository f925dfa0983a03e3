package io.clubone.reminder.vo;

import io.clubone.reminder.sql.SqlSelect;
import lombok.Builder;
import lombok.Value;

/**
 * Eligibility query handed to the reminder scheduler together with the column
 * references it needs to read recipients from the result.
 */
@Value
@Builder
public class RecipientQuery {
	SqlSelect select;
	String addlCheckFrom;
	String contactIdField;
	String entityIdField;
	String contactTableAlias;
	String dateField;
}
