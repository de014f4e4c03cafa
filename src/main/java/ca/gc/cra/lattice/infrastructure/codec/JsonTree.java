package ca.gc.cra.lattice.infrastructure.codec;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streams a JSON document into plain {@link Map}/{@link List}/scalar values.
 *
 * <p>Decoders walk the resulting graph instead of binding to classes; unknown members are ignored.</p>
 */
final class JsonTree {
  private final JsonFactory factory;

  JsonTree(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Parses one JSON document.
   *
   * @param payload UTF-8 JSON bytes
   * @return parsed value graph
   * @throws MalformedJsonException when the bytes are not a single well-formed JSON document
   */
  Object parse(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new MalformedJsonException("empty payload", null);
    }
    try (JsonParser parser = factory.createParser(payload)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new MalformedJsonException("empty document", null);
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new MalformedJsonException("trailing content after JSON document", null);
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new MalformedJsonException(ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new MalformedJsonException(ex.getMessage(), ex);
    }
  }

  /**
   * Parses a document held in a string (the CloudEvents {@code data} member).
   *
   * @param json JSON text
   * @return parsed value graph
   */
  Object parse(String json) {
    return parse(json == null ? null : json.getBytes(StandardCharsets.UTF_8));
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new MalformedJsonException("unexpected token " + token, null);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new MalformedJsonException("expected field name but found " + token, null);
      }
      String name = parser.getCurrentName();
      map.put(name, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }

  /** Raised when a payload is not well-formed JSON. */
  static final class MalformedJsonException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    MalformedJsonException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
