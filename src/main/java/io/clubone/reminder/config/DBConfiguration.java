package io.clubone.reminder.config;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

@Configuration
public class DBConfiguration {

	@Primary
	@Bean(name = "crmDb")
	@ConfigurationProperties(prefix = "spring.datasource.crm")
	public DataSource crmDataSource() {
		return DataSourceBuilder.create().build();
	}

	@Bean(name = "crmJdbcTemplate")
	public JdbcTemplate crmJdbcTemplate(@Qualifier("crmDb") DataSource crmDb) {
		return new JdbcTemplate(crmDb, false);
	}

	@Bean(name = "crmNamedJdbcTemplate")
	public NamedParameterJdbcTemplate crmNamedJdbcTemplate(@Qualifier("crmJdbcTemplate") JdbcTemplate crmJdbcTemplate) {
		return new NamedParameterJdbcTemplate(crmJdbcTemplate);
	}

	@Primary
	@Bean(name = "crmTransactionManager")
	public PlatformTransactionManager crmTransactionManager(@Qualifier("crmDb") DataSource crmDb) {
		return new DataSourceTransactionManager(crmDb);
	}
}
