package my.architrack.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Security security,
		@Valid @NotNull Statements statements
) {
	public record Security(
			@NotBlank String adminUser,
			@NotBlank String adminPass
	) {
	}

	public record Statements(
			@Min(1) @Max(500) int rowPageSize,
			@Min(1) @Max(100) int listPageSize,
			@Min(1) int maxRows,
			@Min(1) @Max(50) int latestLimit
	) {
	}
}
