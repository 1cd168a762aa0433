package my.architrack.app.config;

import my.architrack.app.export.ClipboardTextFormatter;
import my.architrack.app.export.SpreadsheetExporter;
import my.architrack.app.statement.QuantityAggregator;
import my.architrack.app.statement.StatementQueryEngine;
import my.architrack.app.statement.StatementVersionGuard;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StatementEngineConfig {
	@Bean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public QuantityAggregator quantityAggregator() {
		return new QuantityAggregator();
	}

	@Bean
	public StatementQueryEngine statementQueryEngine() {
		return new StatementQueryEngine();
	}

	@Bean
	public StatementVersionGuard statementVersionGuard() {
		return new StatementVersionGuard();
	}

	@Bean
	public SpreadsheetExporter spreadsheetExporter() {
		return new SpreadsheetExporter();
	}

	@Bean
	public ClipboardTextFormatter clipboardTextFormatter() {
		return new ClipboardTextFormatter();
	}
}
