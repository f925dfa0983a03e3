package io.clubone.reminder.dao.impl;

import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import io.clubone.reminder.dao.MembershipStatusDAO;
import io.clubone.reminder.util.ConstantUtility;

@Repository
public class MembershipStatusDAOImpl implements MembershipStatusDAO {

	private static final String SQL_CURRENT_OR_EXPIRED = """
			SELECT id
			FROM membership_status
			WHERE is_current_member = 1 OR name = ?
			ORDER BY id
			""";

	private final JdbcTemplate crmJdbcTemplate;

	public MembershipStatusDAOImpl(@Qualifier("crmJdbcTemplate") JdbcTemplate crmJdbcTemplate) {
		this.crmJdbcTemplate = crmJdbcTemplate;
	}

	@Override
	public List<Long> findCurrentOrExpiredStatusIds() {
		return crmJdbcTemplate.queryForList(SQL_CURRENT_OR_EXPIRED, Long.class, ConstantUtility.EXPIRED_STATUS);
	}
}
