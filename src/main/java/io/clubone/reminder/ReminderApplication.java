package io.clubone.reminder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@OpenAPIDefinition(info = @Info(title = "clubone Membership Reminder Api", version = "1.0", description = "Membership reminder eligibility and payment links"))
@Slf4j
@EnableTransactionManagement
public class ReminderApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReminderApplication.class, args);
		log.info("... Application started Successfully ...");
	}
}
