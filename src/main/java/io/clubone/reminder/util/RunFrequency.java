package io.clubone.reminder.util;

/**
 * Cadence of a scheduled job, stored in scheduled_job.run_frequency.
 */
public enum RunFrequency {
	ALWAYS("Always"),
	HOURLY("Hourly"),
	DAILY("Daily");

	private final String code;

	RunFrequency(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	public static RunFrequency fromDb(String value) {
		if (value == null) {
			return DAILY;
		}
		return switch (value.trim().toUpperCase()) {
			case "ALWAYS" -> ALWAYS;
			case "HOURLY" -> HOURLY;
			default -> DAILY;
		};
	}

	@Override
	public String toString() {
		return code;
	}
}
