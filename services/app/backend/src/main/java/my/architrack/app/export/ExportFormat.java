package my.architrack.app.export;

import java.util.Locale;
import java.util.Optional;

public enum ExportFormat {
	SPREADSHEET("spreadsheet"),
	CLIPBOARD("clipboard");

	private final String key;

	ExportFormat(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	public static Optional<ExportFormat> fromKey(String key) {
		if (key == null || key.isBlank()) {
			return Optional.empty();
		}
		String normalized = key.trim().toLowerCase(Locale.ROOT);
		for (ExportFormat format : values()) {
			if (format.key.equals(normalized)) {
				return Optional.of(format);
			}
		}
		return Optional.empty();
	}
}
