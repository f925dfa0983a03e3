package io.clubone.reminder.dao;

import java.util.List;

public interface MembershipStatusDAO {

	/** Ids of statuses flagged as current membership or named 'Expired'. */
	List<Long> findCurrentOrExpiredStatusIds();
}
