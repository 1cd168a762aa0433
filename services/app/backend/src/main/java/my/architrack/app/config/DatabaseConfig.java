package my.architrack.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import javax.sql.DataSource;

/**
 * Runs the Liquibase changelog before JPA starts, once the database accepts connections.
 */
@Configuration
@EnableConfigurationProperties(DatabaseConfig.SchemaSettings.class)
public class DatabaseConfig {
	private static final String DEFAULT_CHANGE_LOG = "classpath:db/changelog/db.changelog-master.yaml";

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource, SchemaSettings settings) {
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(settings.getStartupTimeoutSeconds());
		validator.setInterval(settings.getStartupIntervalSeconds());
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource, SchemaSettings settings) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		String changeLog = settings.getChangeLog();
		liquibase.setChangeLog(changeLog == null || changeLog.isBlank() ? DEFAULT_CHANGE_LOG : changeLog);
		liquibase.setShouldRun(settings.isEnabled());
		return liquibase;
	}

	@Bean
	public static BeanFactoryPostProcessor liquibaseDependsOnPostProcessor() {
		return beanFactory -> {
			addDependsOn(beanFactory, "entityManagerFactory", "liquibase");
			addDependsOn(beanFactory, "jpaSharedEM_entityManagerFactory", "liquibase");
		};
	}

	private static void addDependsOn(ConfigurableListableBeanFactory beanFactory, String beanName, String dependency) {
		if (!beanFactory.containsBeanDefinition(beanName)) {
			return;
		}
		BeanDefinition definition = beanFactory.getBeanDefinition(beanName);
		Set<String> merged = new LinkedHashSet<>();
		if (definition.getDependsOn() != null) {
			merged.addAll(Arrays.asList(definition.getDependsOn()));
		}
		merged.add(dependency);
		definition.setDependsOn(merged.toArray(new String[0]));
	}

	@ConfigurationProperties(prefix = "app.schema")
	public static class SchemaSettings {
		private String changeLog;
		private boolean enabled = true;
		private int startupTimeoutSeconds = 60;
		private int startupIntervalSeconds = 5;

		public String getChangeLog() {
			return changeLog;
		}

		public void setChangeLog(String changeLog) {
			this.changeLog = changeLog;
		}

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public int getStartupTimeoutSeconds() {
			return startupTimeoutSeconds;
		}

		public void setStartupTimeoutSeconds(int startupTimeoutSeconds) {
			this.startupTimeoutSeconds = startupTimeoutSeconds;
		}

		public int getStartupIntervalSeconds() {
			return startupIntervalSeconds;
		}

		public void setStartupIntervalSeconds(int startupIntervalSeconds) {
			this.startupIntervalSeconds = startupIntervalSeconds;
		}
	}
}
