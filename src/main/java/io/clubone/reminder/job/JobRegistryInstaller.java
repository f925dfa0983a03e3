package io.clubone.reminder.job;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import io.clubone.reminder.dao.ScheduledJobDAO;
import lombok.extern.slf4j.Slf4j;

/**
 * Seeds the scheduled_job table for the configured domain on startup. A domain
 * that already has jobs is left alone, so administrator changes survive
 * restarts.
 */
@Component
@ConditionalOnProperty(prefix = "crm.jobs", name = "seed-on-startup", havingValue = "true")
@Slf4j
public class JobRegistryInstaller implements ApplicationRunner {

	private final ScheduledJobDAO scheduledJobDAO;

	private final Long domainId;

	public JobRegistryInstaller(ScheduledJobDAO scheduledJobDAO, @Value("${crm.domain-id:1}") Long domainId) {
		this.scheduledJobDAO = scheduledJobDAO;
		this.domainId = domainId;
	}

	@Override
	@Transactional
	public void run(ApplicationArguments args) {
		install();
	}

	/**
	 * @return number of jobs inserted
	 */
	public int install() {
		int existing = scheduledJobDAO.countByDomain(domainId);
		if (existing > 0) {
			log.info("Domain {} already has {} scheduled job(s), skipping job seed", domainId, existing);
			return 0;
		}
		int inserted = scheduledJobDAO.batchInsert(JobRegistrySeed.definitions(), domainId).length;
		log.info("Seeded {} scheduled job(s) for domain {}", inserted, domainId);
		return inserted;
	}
}
