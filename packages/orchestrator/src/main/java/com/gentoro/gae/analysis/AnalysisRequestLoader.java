package com.gentoro.gae.analysis;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.gentoro.gae.exception.ConfigException;
import com.gentoro.gae.utility.JacksonUtility;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads analysis requests from YAML. Accepts either a top-level list or an {@code analyses} list:
 *
 * <pre>{@code
 * analyses:
 *   - name: influencers
 *     algorithm: pagerank
 *     graph: social
 *     target_collection: users
 *     params: { damping_factor: 0.9 }
 *     timeout_seconds: 600
 * }</pre>
 *
 * Every request is validated; the first invalid one raises {@link ConfigException}.
 */
public final class AnalysisRequestLoader {
  private static final ObjectReader ENTRY_READER =
      JacksonUtility.getYamlMapper()
          .readerFor(Entry.class)
          .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private AnalysisRequestLoader() {}

  public static List<AnalysisRequest> load(Path file) {
    if (file == null || !Files.isRegularFile(file)) {
      throw new ConfigException("Analysis request file not found: " + file);
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return load(reader, file.toString());
    } catch (IOException e) {
      throw new ConfigException("Could not read analysis requests from " + file, e);
    }
  }

  public static List<AnalysisRequest> parse(String yaml) {
    if (yaml == null || yaml.isBlank()) {
      throw new ConfigException("No analysis requests given");
    }
    try (Reader reader = new StringReader(yaml)) {
      return load(reader, "inline YAML");
    } catch (IOException e) {
      throw new ConfigException("Could not parse analysis requests", e);
    }
  }

  private static List<AnalysisRequest> load(Reader reader, String origin) {
    JsonNode root;
    try {
      root = JacksonUtility.getYamlMapper().readTree(reader);
    } catch (IOException e) {
      throw new ConfigException("Malformed YAML in " + origin + ": " + e.getMessage(), e);
    }
    JsonNode list = root != null && root.isObject() ? root.get("analyses") : root;
    if (list == null || !list.isArray() || list.isEmpty()) {
      throw new ConfigException(origin + " contains no analysis requests");
    }
    List<AnalysisRequest> requests = new ArrayList<>();
    int index = 0;
    for (JsonNode node : list) {
      Entry entry;
      try {
        entry = ENTRY_READER.readValue(node);
      } catch (IOException e) {
        throw new ConfigException(
            "Invalid analysis request #" + index + " in " + origin + ": " + e.getMessage(), e);
      }
      requests.add(entry.toRequest().validate());
      index++;
    }
    return requests;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  static final class Entry {
    public String name;
    public String algorithm;
    public Map<String, Object> params;

    @JsonAlias("graph")
    public String namedGraph;

    public List<String> vertexCollections;
    public List<String> edgeCollections;
    public List<String> vertexAttributes;
    public String database;
    public String targetCollection;
    public String resultField;
    public String engineSize;
    public Long timeoutSeconds;
    public boolean exclusiveEngine;
    public Integer storeParallelism;
    public Integer storeBatchSize;

    AnalysisRequest toRequest() {
      AnalysisRequest.Builder b =
          AnalysisRequest.builder()
              .name(name)
              .params(params)
              .vertexAttributes(vertexAttributes)
              .database(database)
              .targetCollection(targetCollection)
              .resultField(resultField)
              .engineSize(engineSize)
              .exclusiveEngine(exclusiveEngine);
      if (algorithm != null) b.algorithm(algorithm);
      if (timeoutSeconds != null) b.waitTimeout(Duration.ofSeconds(timeoutSeconds));
      if (storeParallelism != null) b.storeParallelism(storeParallelism);
      if (storeBatchSize != null) b.storeBatchSize(storeBatchSize);
      if (namedGraph != null || vertexCollections != null || edgeCollections != null) {
        b.graphSource(new GraphSource(namedGraph, vertexCollections, edgeCollections));
      }
      return b.build();
    }
  }
}
