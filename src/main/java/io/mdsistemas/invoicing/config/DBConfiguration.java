package io.mdsistemas.invoicing.config;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

@Configuration
public class DBConfiguration {

	@Primary
	@Bean(name = "invoicingDb")
	@ConfigurationProperties(prefix = "spring.datasource.invoicing")
	public DataSource invoicingDataSource() {
		return DataSourceBuilder.create().build();
	}

	@Bean(name = "invoicingJdbcTemplate")
	public JdbcTemplate invoicingJdbcTemplate(@Qualifier("invoicingDb") DataSource invoicingDb) {
		return new JdbcTemplate(invoicingDb, false);
	}

	@Bean
	public PlatformTransactionManager transactionManager(@Qualifier("invoicingDb") DataSource invoicingDb) {
		return new DataSourceTransactionManager(invoicingDb);
	}
}
