package my.architrack.app.dto;

import java.time.LocalDateTime;

public record ItemizedStatementDto(
		Long id,
		Long projectId,
		String name,
		Long sourceQuantityTableId,
		String sourceQuantityTableName,
		int itemCount,
		String createdBy,
		LocalDateTime createdAt,
		LocalDateTime updatedAt,
		long version
) {
}
