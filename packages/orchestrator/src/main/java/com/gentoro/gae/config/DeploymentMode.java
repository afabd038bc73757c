package com.gentoro.gae.config;

import com.gentoro.gae.exception.ConfigException;
import java.util.Locale;

/** The two authentication/deployment regimes an engine can live under. */
public enum DeploymentMode {
  /**
   * Managed cloud platform: pre-issued or CLI-issued API token, engines provisioned through a
   * management API with a configurable size, billed per engine-hour.
   */
  MANAGED("managed"),
  /**
   * Self-hosted platform: JWT obtained by logging into the database, engines discovered or
   * started as platform services, size not configurable, not metered.
   */
  SELF_HOSTED("self-hosted");

  private final String id;

  DeploymentMode(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /** Accepts the configuration ids plus the names the platforms are known by. */
  public static DeploymentMode fromId(String value) {
    if (value == null || value.isBlank()) {
      throw new ConfigException("Missing deployment mode");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return switch (normalized) {
      case "managed", "amp", "cloud" -> MANAGED;
      case "self-hosted", "self-managed", "selfhosted", "genai" -> SELF_HOSTED;
      default -> throw new ConfigException("Unknown deployment mode: " + value);
    };
  }
}
