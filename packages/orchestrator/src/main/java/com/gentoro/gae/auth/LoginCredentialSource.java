package com.gentoro.gae.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gae.exception.AuthException;
import com.gentoro.gae.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Obtains a JWT by logging into the database ({@code POST /_open/auth}). The validity is taken
 * from the token's {@code exp} claim when present, otherwise the configured default applies.
 */
public class LoginCredentialSource implements CredentialSource {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(LoginCredentialSource.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final String endpoint;
  private final String username;
  private final String password;
  private final Duration defaultValidity;
  private final Clock clock;

  /**
   * @param client HTTP client without the bearer-auth interceptor
   */
  public LoginCredentialSource(
      OkHttpClient client,
      String endpoint,
      String username,
      String password,
      Duration defaultValidity,
      Clock clock) {
    this.client = client;
    this.endpoint = endpoint;
    this.username = username;
    this.password = password == null ? "" : password;
    this.defaultValidity = defaultValidity;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  @Override
  public Credential obtain() {
    String url = endpoint + "/_open/auth";
    String body = JacksonUtility.toJson(Map.of("username", username, "password", password));
    Request request = new Request.Builder().url(url).post(RequestBody.create(body, JSON)).build();

    try (Response response = client.newCall(request).execute()) {
      if (response.code() == 401 || response.code() == 403) {
        throw new AuthException(
            "Database login rejected for user '%s' at %s (HTTP %d)"
                .formatted(username, endpoint, response.code()));
      }
      if (!response.isSuccessful()) {
        throw new AuthException(
            "Database login failed at %s (HTTP %d)".formatted(endpoint, response.code()));
      }
      ResponseBody rb = response.body();
      JsonNode json = JacksonUtility.getJsonMapper().readTree(rb == null ? "" : rb.string());
      String jwt = json == null ? null : json.path("jwt").asText(null);
      if (jwt == null || jwt.isBlank()) {
        throw new AuthException("Database login response did not contain a JWT");
      }
      Instant now = clock.instant();
      Duration validity = validityFromClaims(jwt, now);
      log.debug("Obtained JWT for user '{}' valid for {}", username, validity);
      return new Credential(jwt, now, validity);
    } catch (IOException e) {
      throw new AuthException("Database login request to " + endpoint + " failed", e);
    }
  }

  /** Reads {@code exp} from the unverified payload. Falls back to the default validity. */
  Duration validityFromClaims(String jwt, Instant now) {
    String[] parts = jwt.split("\\.");
    if (parts.length < 2) return defaultValidity;
    try {
      byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
      JsonNode claims =
          JacksonUtility.getJsonMapper().readTree(new String(payload, StandardCharsets.UTF_8));
      JsonNode exp = claims.get("exp");
      if (exp == null || !exp.canConvertToLong()) return defaultValidity;
      Duration remaining = Duration.between(now, Instant.ofEpochSecond(exp.asLong()));
      return remaining.isNegative() || remaining.isZero() ? defaultValidity : remaining;
    } catch (IllegalArgumentException | IOException e) {
      log.debug("Could not read JWT claims, using default validity: {}", e.getMessage());
      return defaultValidity;
    }
  }

  @Override
  public String describe() {
    return "database login as '" + username + "'";
  }
}
