package dev.harvest.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Minimal JSON helper built on Jackson streaming: parses documents into {@link Map}/{@link List}
 * graphs and writes such graphs back, optionally in canonical (key-sorted, compact) form.
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private static final JsonSupport SHARED = new JsonSupport();

  private final JsonFactory factory = new JsonFactory();

  /** Shared instance. */
  public static JsonSupport shared() {
    return SHARED;
  }

  /**
   * Parses the supplied JSON text into a mutable object graph of maps, lists, and scalars.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty document yields an empty map
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses UTF-8 JSON bytes.
   *
   * @param json JSON document bytes
   * @return parsed object graph
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(byte[] json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON object.
   *
   * @param json JSON text
   * @return object members in document order
   * @throws IllegalArgumentException when the document is not an object
   */
  public Map<String, Object> parseObject(String json) {
    Object value = parse(json);
    if (!(value instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("Expected JSON object");
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> map = (Map<String, Object>) value;
    return map;
  }

  /**
   * Writes a value compactly with map keys in iteration order.
   *
   * @param value map, list or scalar
   * @return JSON text
   */
  public String write(Object value) {
    return writeString(value, false);
  }

  /**
   * Writes a value compactly with map keys sorted at every level. Equal graphs yield equal text.
   *
   * @param value map, list or scalar
   * @return canonical JSON text
   */
  public String writeCanonical(Object value) {
    return writeString(value, true);
  }

  /**
   * Writes a value as indented UTF-8 bytes with sorted keys, for files humans may read.
   *
   * @param value map, list or scalar
   * @return UTF-8 bytes
   */
  public byte[] writePretty(Object value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.useDefaultPrettyPrinter();
      writeValue(generator, value, true);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to serialize JSON", ex);
    }
    return out.toByteArray();
  }

  private String writeString(Object value, boolean sorted) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      writeValue(generator, value, sorted);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to serialize JSON", ex);
    }
    return out.toString();
  }

  private void writeValue(JsonGenerator generator, Object value, boolean sorted) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      generator.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof Number number) {
      generator.writeNumber(number.doubleValue());
    } else if (value instanceof Map<?, ?> map) {
      Map<?, ?> entries = map;
      if (sorted && !(map instanceof TreeMap<?, ?>)) {
        Map<String, Object> copy = new TreeMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        entries = copy;
      }
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : entries.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue(), sorted);
      }
      generator.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item, sorted);
      }
      generator.writeEndArray();
    } else {
      generator.writeString(value.toString());
    }
  }

  private Object readDocument(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      return new LinkedHashMap<String, Object>();
    }
    Object value = readValue(parser, token);
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new IllegalArgumentException("JSON document contains trailing content");
    }
    return value;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of JSON input");
    }
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

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
