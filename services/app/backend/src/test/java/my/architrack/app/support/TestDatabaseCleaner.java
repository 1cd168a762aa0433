package my.architrack.app.support;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TestDatabaseCleaner {
	private final JdbcTemplate jdbcTemplate;

	public TestDatabaseCleaner(JdbcTemplate jdbcTemplate) {
		this.jdbcTemplate = jdbcTemplate;
	}

	public void clean() {
		List<String> tables = jdbcTemplate.queryForList("""
				select table_name
				from information_schema.tables
				where lower(table_schema) = 'public'
				  and table_type = 'BASE TABLE'
				  and lower(table_name) not in ('databasechangelog', 'databasechangeloglock')
				""", String.class);
		if (tables.isEmpty()) {
			return;
		}
		jdbcTemplate.execute("set referential_integrity false");
		try {
			for (String table : tables) {
				jdbcTemplate.execute("truncate table \"" + table + "\" restart identity");
			}
		} finally {
			jdbcTemplate.execute("set referential_integrity true");
		}
	}
}
