package my.architrack.app.export;

public record ExportedFile(String filename, String contentType, byte[] content) {
}
