package io.clubone.reminder.dao;

import java.util.List;

import io.clubone.reminder.vo.ScheduledJobDTO;
import io.clubone.reminder.vo.ScheduledJobDefinition;

public interface ScheduledJobDAO {

	int countByDomain(Long domainId);

	int[] batchInsert(List<ScheduledJobDefinition> definitions, Long domainId);

	List<ScheduledJobDTO> findByDomain(Long domainId);
}
