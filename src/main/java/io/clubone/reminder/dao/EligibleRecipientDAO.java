package io.clubone.reminder.dao;

import java.util.List;

import io.clubone.reminder.vo.EligibleRecipient;
import io.clubone.reminder.vo.RecipientQuery;

public interface EligibleRecipientDAO {

	List<EligibleRecipient> findRecipients(RecipientQuery query);
}
