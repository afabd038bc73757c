package com.gentoro.gae.catalog;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

/**
 * What the execution catalog learns about one finished execution. Timestamps are ISO-8601
 * strings.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExecutionRecord(
    String executionId,
    String requestName,
    String algorithm,
    String algorithmVersion,
    Map<String, Object> parameters,
    String graphReference,
    String database,
    String targetCollection,
    long resultCount,
    long elapsedMillis,
    double estimatedCostUsd,
    String status,
    String error,
    String engineId,
    String engineSize,
    String deploymentMode,
    int retryCount,
    long vertexCount,
    long edgeCount,
    String startedAt,
    String finishedAt) {}
