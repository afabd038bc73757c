package com.gentoro.gae.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gentoro.gae.exception.RemoteRequestException;

/** Shared, pre-configured Jackson mappers. */
public final class JacksonUtility {
  private static final ObjectMapper JSON = configure(new ObjectMapper());
  private static final ObjectMapper YAML = configure(new ObjectMapper(new YAMLFactory()));

  private JacksonUtility() {}

  private static ObjectMapper configure(ObjectMapper mapper) {
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    return mapper;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON;
  }

  public static ObjectMapper getYamlMapper() {
    return YAML;
  }

  public static String toJson(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new RemoteRequestException("Failed to serialize request body", e);
    }
  }
}
