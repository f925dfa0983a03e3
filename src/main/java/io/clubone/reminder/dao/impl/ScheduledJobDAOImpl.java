package io.clubone.reminder.dao.impl;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import io.clubone.reminder.dao.ScheduledJobDAO;
import io.clubone.reminder.util.RunFrequency;
import io.clubone.reminder.vo.ScheduledJobDTO;
import io.clubone.reminder.vo.ScheduledJobDefinition;

@Repository
public class ScheduledJobDAOImpl implements ScheduledJobDAO {

	private static final String SQL_INSERT = """
			INSERT INTO scheduled_job (
			    domain_id, run_frequency, last_run, name, description,
			    api_entity, api_action, parameters, is_active
			) VALUES (?, ?, NULL, ?, ?, ?, ?, ?, ?)
			""";

	private static final String SQL_COUNT_BY_DOMAIN = "SELECT COUNT(*) FROM scheduled_job WHERE domain_id = ?";

	private static final String SQL_FIND_BY_DOMAIN = """
			SELECT id, domain_id, run_frequency, last_run, name, description,
			       api_entity, api_action, parameters, is_active
			FROM scheduled_job
			WHERE domain_id = ?
			ORDER BY id
			""";

	private final RowMapper<ScheduledJobDTO> rowMapper = new RowMapper<>() {
		@Override
		public ScheduledJobDTO mapRow(ResultSet rs, int rowNum) throws SQLException {
			ScheduledJobDTO dto = new ScheduledJobDTO();
			dto.setId(rs.getLong("id"));
			dto.setDomainId(rs.getLong("domain_id"));
			dto.setRunFrequency(RunFrequency.fromDb(rs.getString("run_frequency")));
			dto.setLastRun(rs.getObject("last_run", OffsetDateTime.class));
			dto.setName(rs.getString("name"));
			dto.setDescription(rs.getString("description"));
			dto.setApiEntity(rs.getString("api_entity"));
			dto.setApiAction(rs.getString("api_action"));
			dto.setParameters(rs.getString("parameters"));
			dto.setIsActive(rs.getInt("is_active") == 1);
			return dto;
		}
	};

	private final JdbcTemplate crmJdbcTemplate;

	public ScheduledJobDAOImpl(@Qualifier("crmJdbcTemplate") JdbcTemplate crmJdbcTemplate) {
		this.crmJdbcTemplate = crmJdbcTemplate;
	}

	@Override
	public int countByDomain(Long domainId) {
		Integer count = crmJdbcTemplate.queryForObject(SQL_COUNT_BY_DOMAIN, Integer.class, domainId);
		return count == null ? 0 : count;
	}

	@Override
	public int[] batchInsert(List<ScheduledJobDefinition> definitions, Long domainId) {
		if (definitions == null || definitions.isEmpty())
			return new int[0];
		return crmJdbcTemplate.batchUpdate(SQL_INSERT, new BatchPreparedStatementSetter() {
			@Override
			public void setValues(PreparedStatement ps, int i) throws SQLException {
				ScheduledJobDefinition d = definitions.get(i);
				ps.setLong(1, domainId);
				ps.setString(2, d.getRunFrequency().getCode());
				ps.setString(3, d.getName());
				ps.setString(4, d.getDescription());
				ps.setString(5, d.getApiEntity());
				ps.setString(6, d.getApiAction());
				if (d.getParameters() == null)
					ps.setNull(7, Types.VARCHAR);
				else
					ps.setString(7, d.getParameters());
				ps.setInt(8, d.isActive() ? 1 : 0);
			}

			@Override
			public int getBatchSize() {
				return definitions.size();
			}
		});
	}

	@Override
	public List<ScheduledJobDTO> findByDomain(Long domainId) {
		return crmJdbcTemplate.query(SQL_FIND_BY_DOMAIN, rowMapper, domainId);
	}
}
