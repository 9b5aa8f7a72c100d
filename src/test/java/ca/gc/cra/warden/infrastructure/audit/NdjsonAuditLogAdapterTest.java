package ca.gc.cra.warden.infrastructure.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.warden.application.json.JsonDocuments;
import ca.gc.cra.warden.domain.incident.IncidentType;
import ca.gc.cra.warden.domain.incident.ResponseActionType;
import ca.gc.cra.warden.domain.incident.SecurityIncident;
import ca.gc.cra.warden.domain.incident.SourceSystem;
import ca.gc.cra.warden.domain.security.Severity;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonAuditLogAdapterTest {

  @TempDir Path tempDir;

  private static SecurityIncident incident(String id, String description) {
    return new SecurityIncident(id, Instant.parse("2024-05-01T12:00:00Z"), IncidentType.BOUNDARY_VIOLATION,
        Severity.HIGH, SourceSystem.BOUNDARY_ENGINE, "proj1", null, description, Map.of(),
        List.of(ResponseActionType.ALERT_SECURITY_TEAM, ResponseActionType.BLOCK_ACCESS));
  }

  @Test
  void appendsOneJsonObjectPerLine() throws IOException {
    Path file = tempDir.resolve("audit/incidents.ndjson");
    try (NdjsonAuditLogAdapter adapter = new NdjsonAuditLogAdapter(file)) {
      adapter.append(incident("INC-1", "first"));
      adapter.append(incident("INC-2", "second\nline"));
      assertEquals(2, adapter.written());
    }

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    Map<String, Object> first = JsonDocuments.parseObject(lines.get(0));
    assertEquals("INC-1", first.get("id"));
    assertEquals("boundary_violation", first.get("type"));
    assertEquals("high", first.get("severity"));
    assertEquals("boundary_engine", first.get("source"));
    assertEquals("2024-05-01T12:00:00Z", first.get("timestamp"));
    assertNull(first.get("target_path"));
    assertEquals(List.of("alert_security_team", "block_access"), first.get("response_actions"));
    assertEquals("second\nline", JsonDocuments.parseObject(lines.get(1)).get("description"));
  }

  @Test
  void reopeningAppendsToTheExistingFile() throws IOException {
    Path file = tempDir.resolve("incidents.ndjson");
    try (NdjsonAuditLogAdapter adapter = new NdjsonAuditLogAdapter(file)) {
      adapter.append(incident("INC-1", "first"));
    }
    try (NdjsonAuditLogAdapter adapter = new NdjsonAuditLogAdapter(file)) {
      adapter.append(incident("INC-2", "second"));
      assertEquals(1, adapter.written());
    }

    assertEquals(2, Files.readAllLines(file, StandardCharsets.UTF_8).size());
  }
}
