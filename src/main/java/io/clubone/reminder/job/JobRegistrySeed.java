package io.clubone.reminder.job;

import java.util.List;

import io.clubone.reminder.util.RunFrequency;
import io.clubone.reminder.vo.ScheduledJobDefinition;

/**
 * Background jobs installed with a new domain. Only the update check is active
 * out of the box; administrators enable the rest.
 */
public final class JobRegistrySeed {

	private static final List<ScheduledJobDefinition> DEFINITIONS = List.of(
			job(RunFrequency.DAILY, "CiviCRM Update Check",
					"Checks for CiviCRM version updates. Important for keeping the database secure. Also sends anonymous usage statistics to civicrm.org to assist in prioritizing ongoing development efforts.",
					"job", "version_check", null, true),
			job(RunFrequency.ALWAYS, "Send Scheduled Mailings", "Sends out scheduled CiviMail mailings",
					"job", "process_mailing", null, false),
			job(RunFrequency.HOURLY, "Fetch Bounces",
					"Fetches bounces from mailings and writes them to mailing statistics",
					"job", "fetch_bounces", null, false),
			job(RunFrequency.HOURLY, "Process Inbound Emails",
					"Inserts activity for a contact or a case by retrieving inbound emails from a mail directory",
					"job", "fetch_activities", null, false),
			job(RunFrequency.DAILY, "Process Pledges", "Updates pledge records and sends out reminders",
					"job", "process_pledge", "send_reminders=[1 or 0] optional- 1 to send payment reminders", false),
			job(RunFrequency.DAILY, "Geocode and Parse Addresses",
					"Retrieves geocodes (lat and long) and / or parses street addresses (populates street number, street name, etc.)",
					"job", "geocode", """
							geocoding=[1 or 0] required
							parse=[1 or 0] required
							start=[contact ID] optional-begin with this contact ID
							end=[contact ID] optional-process contacts with IDs less than this
							throttle=[1 or 0] optional-1 adds five second sleep""", false),
			job(RunFrequency.DAILY, "Update Greetings and Addressees",
					"Goes through contact records and updates email and postal greetings, or addressee value",
					"job", "update_greeting", """
							ct=[Individual or Household or Organization] required
							gt=[email_greeting or postal_greeting or addressee] required
							force=[0 or 1] optional-0 update contacts with null value, 1 update all
							limit=Number optional-Limit the number of contacts to update""", false),
			job(RunFrequency.DAILY, "Mail Reports", "Generates and sends out reports via email",
					"job", "mail_report", """
							instanceId=[ID of report instance] required
							format=[csv or print] optional-output CSV or print-friendly HTML, else PDF""", false),
			job(RunFrequency.HOURLY, "Send Scheduled Reminders", "Sends out scheduled reminders via email",
					"job", "send_reminder", null, false),
			job(RunFrequency.ALWAYS, "Update Participant Statuses",
					"Updates pending event participant statuses based on time",
					"job", "process_participant", null, false),
			job(RunFrequency.DAILY, "Update Membership Statuses",
					"Updates membership statuses. WARNING: Membership renewal reminders have been migrated to the Schedule Reminders functionality, which supports multiple renewal reminders.",
					"job", "process_membership", null, false),
			job(RunFrequency.ALWAYS, "Process Survey Respondents",
					"Releases reserved survey respondents when they have been reserved for longer than the Release Frequency days specified for that survey.",
					"job", "process_respondent", null, false),
			job(RunFrequency.HOURLY, "Clean-up Temporary Data and Files",
					"Removes temporary data and files, and clears old data from cache tables. Recommend running this job every hour to help prevent database and file system bloat.",
					"job", "cleanup", null, false),
			job(RunFrequency.ALWAYS, "Send Scheduled SMS", "Sends out scheduled SMS",
					"job", "process_sms", null, false),
			job(RunFrequency.ALWAYS, "Rebuild Smart Group Cache", "Rebuilds the smart group cache.",
					"job", "group_rebuild", "limit=Number optional-Limit the number of smart groups rebuild", false),
			job(RunFrequency.DAILY, "Disable expired relationships",
					"Disables relationships that have expired (ie. those relationships whose end date is in the past).",
					"job", "disable_expired_relationships", null, false),
			job(RunFrequency.DAILY, "Validate Email Address from Mailings.",
					"Updates the reset_date on an email address to indicate that there was a valid delivery to this email address.",
					"mailing", "update_email_resetdate",
					"minDays, maxDays=Consider mailings that have completed between minDays and maxDays", false));

	private JobRegistrySeed() {
	}

	public static List<ScheduledJobDefinition> definitions() {
		return DEFINITIONS;
	}

	private static ScheduledJobDefinition job(RunFrequency frequency, String name, String description,
			String apiEntity, String apiAction, String parameters, boolean active) {
		return ScheduledJobDefinition.builder()
				.runFrequency(frequency)
				.name(name)
				.description(description)
				.apiEntity(apiEntity)
				.apiAction(apiAction)
				.parameters(parameters)
				.active(active)
				.build();
	}
}
