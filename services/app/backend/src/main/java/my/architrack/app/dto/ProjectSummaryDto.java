package my.architrack.app.dto;

public record ProjectSummaryDto(Long id, String name) {
}
