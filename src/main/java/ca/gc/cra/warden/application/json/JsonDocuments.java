package ca.gc.cra.warden.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper converting between text and {@link Map}/{@link List} object graphs.
 *
 * <p>Writing accepts maps with string keys, iterables, strings, numbers, booleans, {@code null}, enums (written as
 * lower-case names), {@link Instant}s (ISO-8601) and {@link Path}s; any other value is written via
 * {@link Object#toString()}.</p>
 *
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 *
 * @since 0.1.0
 */
public final class JsonDocuments {
  private static final JsonFactory FACTORY = new JsonFactory();

  private JsonDocuments() {}

  /**
   * Parses a JSON object document.
   *
   * @param json JSON text; never {@code null}
   * @return mutable map of the top-level object
   * @throws IllegalArgumentException when the text is not a single JSON object
   */
  public static Map<String, Object> parseObject(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = FACTORY.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("JSON document must be an object");
      }
      Map<String, Object> value = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON document", ex);
    }
  }

  /**
   * Renders a value as compact JSON.
   *
   * @param value object graph to render
   * @return JSON text
   */
  public static String write(Object value) {
    StringWriter out = new StringWriter();
    try {
      write(value, out, false);
    } catch (IOException ex) {
      throw new IllegalStateException("StringWriter failed", ex);
    }
    return out.toString();
  }

  /**
   * Renders a value as indented JSON.
   *
   * @param value object graph to render
   * @return JSON text
   */
  public static String writePretty(Object value) {
    StringWriter out = new StringWriter();
    try {
      write(value, out, true);
    } catch (IOException ex) {
      throw new IllegalStateException("StringWriter failed", ex);
    }
    return out.toString();
  }

  /**
   * Writes a value as indented JSON to {@code file}, replacing existing content.
   *
   * @param file destination
   * @param value object graph to render
   * @throws IOException when the file cannot be written
   */
  public static void writeFile(Path file, Object value) throws IOException {
    Objects.requireNonNull(file, "file");
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(value, writer, true);
    }
  }

  private static void write(Object value, Writer out, boolean pretty) throws IOException {
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      writeValue(gen, value);
    }
  }

  private static void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number number) {
      gen.writeNumber(number.doubleValue());
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Enum<?> constant) {
      gen.writeString(constant.name().toLowerCase(Locale.ROOT));
    } else {
      gen.writeString(value.toString());
    }
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        return map;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        return list;
      }
      list.add(readValue(parser, token));
    }
  }
}
