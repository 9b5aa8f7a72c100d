package ca.gc.cra.warden.infrastructure.audit;

import ca.gc.cra.warden.application.port.AuditLogPort;
import ca.gc.cra.warden.domain.incident.ResponseActionType;
import ca.gc.cra.warden.domain.incident.SecurityIncident;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Appends one JSON object per incident to a newline-delimited audit file.
 * <p><strong>Role:</strong> Default {@link AuditLogPort}; the file is opened lazily in append mode and flushed after
 * every record.</p>
 * <p><strong>Thread-safety:</strong> Appends are synchronized.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonAuditLogAdapter implements AuditLogPort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonAuditLogAdapter.class);
  private static final JsonFactory FACTORY = new JsonFactory();

  private final Path file;
  private BufferedWriter writer;
  private long written;

  /**
   * Creates an adapter writing to {@code file}; parent directories are created on first append.
   *
   * @param file audit file
   */
  public NdjsonAuditLogAdapter(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized void append(SecurityIncident incident) throws IOException {
    Objects.requireNonNull(incident, "incident");
    String line = render(incident);
    BufferedWriter out = ensureWriter();
    out.write(line);
    out.newLine();
    out.flush();
    written++;
  }

  /**
   * Number of records appended by this instance.
   *
   * @return record count
   */
  public synchronized long written() {
    return written;
  }

  static String render(SecurityIncident incident) throws IOException {
    StringWriter buffer = new StringWriter(256);
    try (JsonGenerator gen = FACTORY.createGenerator(buffer)) {
      gen.writeStartObject();
      gen.writeStringField("timestamp", incident.timestamp().toString());
      gen.writeStringField("id", incident.id());
      gen.writeStringField("type", incident.incidentType().wireName());
      gen.writeStringField("severity", incident.severity().wireName());
      gen.writeStringField("source", incident.sourceSystem().wireName());
      gen.writeStringField("project_id", incident.projectId());
      gen.writeStringField("target_path", incident.targetPath());
      gen.writeStringField("description", incident.description());
      gen.writeArrayFieldStart("response_actions");
      for (ResponseActionType action : incident.responseActions()) {
        gen.writeString(action.wireName());
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    return buffer.toString();
  }

  private BufferedWriter ensureWriter() throws IOException {
    if (writer == null) {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
      log.info("Security audit log opened at {}", file);
    }
    return writer;
  }

  @Override
  public synchronized void close() throws IOException {
    if (writer != null) {
      try {
        writer.close();
      } finally {
        writer = null;
      }
    }
  }
}
