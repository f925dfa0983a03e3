package io.clubone.reminder.dao.impl;

import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import io.clubone.reminder.dao.EligibleRecipientDAO;
import io.clubone.reminder.sql.SqlSelect;
import io.clubone.reminder.vo.EligibleRecipient;
import io.clubone.reminder.vo.RecipientQuery;
import lombok.extern.slf4j.Slf4j;

@Repository
@Slf4j
public class EligibleRecipientDAOImpl implements EligibleRecipientDAO {

	// date fields come from administrator configuration and are only selected when they name a plain column
	private static final Pattern COLUMN_REFERENCE = Pattern.compile("[a-z][a-z0-9_]*\\.[a-z][a-z0-9_]*");

	private static final String NO_TRIGGER_DATE = "CAST(NULL AS DATE)";

	private static final RowMapper<EligibleRecipient> MAPPER = (rs, rowNum) -> new EligibleRecipient(
			rs.getLong("recipient_contact_id"), rs.getLong("recipient_entity_id"),
			rs.getObject("recipient_trigger_date", LocalDate.class));

	private final NamedParameterJdbcTemplate crmNamedJdbcTemplate;

	public EligibleRecipientDAOImpl(@Qualifier("crmNamedJdbcTemplate") NamedParameterJdbcTemplate crmNamedJdbcTemplate) {
		this.crmNamedJdbcTemplate = crmNamedJdbcTemplate;
	}

	@Override
	public List<EligibleRecipient> findRecipients(RecipientQuery query) {
		String dateField = query.getDateField();
		if (dateField == null || !COLUMN_REFERENCE.matcher(dateField).matches()) {
			log.warn("Ignoring trigger date field '{}', it is not a column reference", dateField);
			dateField = NO_TRIGGER_DATE;
		}
		SqlSelect select = query.getSelect().toBuilder()
				.select(query.getContactIdField() + " AS recipient_contact_id",
						query.getEntityIdField() + " AS recipient_entity_id",
						dateField + " AS recipient_trigger_date")
				.build();
		String sql = select.toSql();
		log.debug("Eligible recipient query: {} params: {}", sql, select.getParams());
		// permission joins can repeat a membership once per matching relationship
		return crmNamedJdbcTemplate.query(sql, new MapSqlParameterSource(select.getParams()), MAPPER)
				.stream()
				.distinct()
				.toList();
	}
}
