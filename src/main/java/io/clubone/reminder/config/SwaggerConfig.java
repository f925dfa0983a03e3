package io.clubone.reminder.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;

/**
 * OpenAPI document of the service, split into a reminder group (mappings and
 * recipient preview) and a membership payment group.
 */
@Configuration
public class SwaggerConfig {

	@Value("${swagger.title}")
	private String title;

	@Value("${swagger.description}")
	private String description;

	@Value("${swagger.version}")
	private String version;

	@Value("${swagger.contact.name}")
	private String contactName;

	@Value("${swagger.contact.url}")
	private String contactURL;

	@Value("${swagger.contact.email}")
	private String contactEmail;

	@Value("${swagger.license}")
	private String license;

	@Value("${swagger.licenseUrl}")
	private String licenseURL;

	@Bean
	public OpenAPI reminderApi() {
		return new OpenAPI().info(new Info()
				.title(title)
				.description(description)
				.version(version)
				.contact(new Contact().name(contactName).email(contactEmail).url(contactURL))
				.license(new License().name(license).url(licenseURL)));
	}

	@Bean
	public GroupedOpenApi scheduledReminderGroup() {
		return GroupedOpenApi.builder()
				.group("scheduled-reminders")
				.displayName("Scheduled Reminders")
				.pathsToMatch("/action-mappings/**", "/action-schedules/**")
				.build();
	}

	@Bean
	public GroupedOpenApi membershipPaymentGroup() {
		return GroupedOpenApi.builder()
				.group("membership-payments")
				.displayName("Membership Payments")
				.pathsToMatch("/membership-payments/**")
				.build();
	}
}
