package com.github.spud.sample.alexa.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.spud.sample.alexa.domain.error.ProtocolException;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
    .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, clazz), Exception.class);
  }

  public static <T> T fromJson(String json, TypeReference<T> typeReference) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, typeReference), Exception.class);
  }

  /**
   * 解析后端响应体，失败时抛出 {@link ProtocolException}
   */
  public static JsonNode readBody(String body, String what) {
    if (body == null || body.isBlank()) {
      throw new ProtocolException("Empty " + what + " response");
    }
    try {
      return readTree(body);
    } catch (JsonParseException e) {
      throw new ProtocolException("Failed to parse " + what + " response", e);
    }
  }

  public static <T> T readBody(String body, Class<T> clazz, String what) {
    if (body == null || body.isBlank()) {
      throw new ProtocolException("Empty " + what + " response");
    }
    try {
      return fromJson(body, clazz);
    } catch (JsonParseException e) {
      throw new ProtocolException("Failed to parse " + what + " response", e);
    }
  }

  public static <T> T readBody(String body, TypeReference<T> typeReference, String what) {
    if (body == null || body.isBlank()) {
      throw new ProtocolException("Empty " + what + " response");
    }
    try {
      return fromJson(body, typeReference);
    } catch (JsonParseException e) {
      throw new ProtocolException("Failed to parse " + what + " response", e);
    }
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return fromJson(json, new TypeReference<Map<String, Object>>() {
    });
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return fromJson(json, new TypeReference<List<Object>>() {
    });
  }

}
