package io.clubone.reminder.dao;

import java.util.Optional;

import io.clubone.reminder.vo.ActionSchedule;

public interface ActionScheduleDAO {

	Optional<ActionSchedule> findById(Long actionScheduleId);
}
