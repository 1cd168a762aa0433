package my.architrack.app.statement;

import java.util.Locale;
import java.util.Optional;

public enum SortDirection {
	ASC,
	DESC;

	public SortDirection flip() {
		return this == ASC ? DESC : ASC;
	}

	public String key() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static Optional<SortDirection> fromKey(String key) {
		if (key == null || key.isBlank()) {
			return Optional.empty();
		}
		return switch (key.trim().toLowerCase(Locale.ROOT)) {
			case "asc" -> Optional.of(ASC);
			case "desc" -> Optional.of(DESC);
			default -> Optional.empty();
		};
	}
}
