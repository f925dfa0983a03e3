package io.clubone.reminder.dao.impl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.clubone.reminder.support.EmbeddedDatabaseSupport;

@DisplayName("MembershipStatusDAOImpl")
class MembershipStatusDAOImplTest extends EmbeddedDatabaseSupport {

	@Test
	@DisplayName("current statuses and Expired")
	void currentOrExpired() {
		assertThat(new MembershipStatusDAOImpl(jdbcTemplate).findCurrentOrExpiredStatusIds())
				.containsExactly(1L, 2L, 3L, 4L);
	}

	@Test
	@DisplayName("nothing when no status qualifies")
	void none() {
		jdbcTemplate.update("UPDATE membership_status SET is_current_member = 0, name = name || ' (old)'");

		assertThat(new MembershipStatusDAOImpl(jdbcTemplate).findCurrentOrExpiredStatusIds()).isEmpty();
	}
}
