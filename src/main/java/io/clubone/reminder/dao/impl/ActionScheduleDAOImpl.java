package io.clubone.reminder.dao.impl;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import io.clubone.reminder.dao.ActionScheduleDAO;
import io.clubone.reminder.util.PaddedValues;
import io.clubone.reminder.vo.ActionSchedule;

@Repository
public class ActionScheduleDAOImpl implements ActionScheduleDAO {

	private static final String SQL_FIND_BY_ID = """
			SELECT id, mapping_id, title, entity_value, entity_status,
			       start_action_date, absolute_date, is_active
			FROM action_schedule
			WHERE id = ?
			""";

	private static final RowMapper<ActionSchedule> MAPPER = new RowMapper<>() {
		@Override
		public ActionSchedule mapRow(ResultSet rs, int rowNum) throws SQLException {
			return ActionSchedule.builder()
					.id(rs.getLong("id"))
					.mappingId(rs.getInt("mapping_id"))
					.title(rs.getString("title"))
					.entityValue(PaddedValues.explode(rs.getString("entity_value")))
					.entityStatus(PaddedValues.explode(rs.getString("entity_status")))
					.startActionDate(rs.getString("start_action_date"))
					.absoluteDate(rs.getObject("absolute_date", LocalDate.class))
					.isActive(rs.getInt("is_active") == 1)
					.build();
		}
	};

	private final JdbcTemplate crmJdbcTemplate;

	public ActionScheduleDAOImpl(@Qualifier("crmJdbcTemplate") JdbcTemplate crmJdbcTemplate) {
		this.crmJdbcTemplate = crmJdbcTemplate;
	}

	@Override
	public Optional<ActionSchedule> findById(Long actionScheduleId) {
		return crmJdbcTemplate.query(SQL_FIND_BY_ID, MAPPER, actionScheduleId).stream().findFirst();
	}
}
