package io.clubone.reminder.dao.impl;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import io.clubone.reminder.dao.MembershipPaymentDAO;
import io.clubone.reminder.dao.MembershipPaymentSchema;
import io.clubone.reminder.exception.CrmDataAccessException;
import io.clubone.reminder.util.ConstantUtility;
import io.clubone.reminder.vo.MembershipPaymentDTO;
import lombok.extern.slf4j.Slf4j;

@Repository
@Slf4j
public class MembershipPaymentDAOImpl implements MembershipPaymentDAO {

	private static final String TABLE = MembershipPaymentSchema.TABLE_NAME;

	private static final String SQL_INSERT = "INSERT INTO " + TABLE + " (membership_id, contribution_id) VALUES (?, ?)";

	private static final String SQL_SELECT = "SELECT id, membership_id, contribution_id FROM " + TABLE;

	private static final RowMapper<MembershipPaymentDTO> MAPPER = new RowMapper<>() {
		@Override
		public MembershipPaymentDTO mapRow(ResultSet rs, int rowNum) throws SQLException {
			return new MembershipPaymentDTO(rs.getLong("id"), rs.getLong("membership_id"),
					rs.getObject("contribution_id", Long.class));
		}
	};

	private final JdbcTemplate crmJdbcTemplate;

	public MembershipPaymentDAOImpl(@Qualifier("crmJdbcTemplate") JdbcTemplate crmJdbcTemplate) {
		this.crmJdbcTemplate = crmJdbcTemplate;
	}

	@Override
	public MembershipPaymentDTO insert(Long membershipId, Long contributionId) {
		KeyHolder keyHolder = new GeneratedKeyHolder();
		try {
			crmJdbcTemplate.update(con -> {
				PreparedStatement ps = con.prepareStatement(SQL_INSERT, new String[] { "id" });
				ps.setLong(1, membershipId);
				if (contributionId == null) {
					ps.setNull(2, Types.BIGINT);
				} else {
					ps.setLong(2, contributionId);
				}
				return ps;
			}, keyHolder);
		} catch (DuplicateKeyException e) {
			log.warn("Contribution {} is already linked to membership {}", contributionId, membershipId);
			throw new CrmDataAccessException("Contribution " + contributionId + " is already linked to membership "
					+ membershipId, ConstantUtility.MEMBERSHIP_PAYMENT_DUPLICATE, e, contributionId, membershipId);
		}
		Number key = keyHolder.getKey();
		return new MembershipPaymentDTO(key == null ? null : key.longValue(), membershipId, contributionId);
	}

	@Override
	public Optional<MembershipPaymentDTO> findById(Long id) {
		return crmJdbcTemplate.query(SQL_SELECT + " WHERE id = ?", MAPPER, id).stream().findFirst();
	}

	@Override
	public List<MembershipPaymentDTO> findByMembershipId(Long membershipId) {
		return crmJdbcTemplate.query(SQL_SELECT + " WHERE membership_id = ? ORDER BY id", MAPPER, membershipId);
	}

	@Override
	public List<MembershipPaymentDTO> findByContributionId(Long contributionId) {
		return crmJdbcTemplate.query(SQL_SELECT + " WHERE contribution_id = ? ORDER BY id", MAPPER, contributionId);
	}

	@Override
	public int deleteById(Long id) {
		return crmJdbcTemplate.update("DELETE FROM " + TABLE + " WHERE id = ?", id);
	}

	@Override
	public int deleteByMembershipId(Long membershipId) {
		return crmJdbcTemplate.update("DELETE FROM " + TABLE + " WHERE membership_id = ?", membershipId);
	}

	@Override
	public int deleteByContributionId(Long contributionId) {
		return crmJdbcTemplate.update("DELETE FROM " + TABLE + " WHERE contribution_id = ?", contributionId);
	}
}
