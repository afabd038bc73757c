package com.gentoro.gae.http;

import static com.gentoro.gae.support.ScriptedInterceptor.*;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gae.auth.CredentialManager;
import com.gentoro.gae.exception.AuthException;
import com.gentoro.gae.exception.RemoteNotFoundException;
import com.gentoro.gae.exception.RemoteRequestException;
import com.gentoro.gae.exception.TransientNetworkException;
import com.gentoro.gae.support.MutableClock;
import com.gentoro.gae.support.ScriptedInterceptor;
import com.gentoro.gae.support.StaticCredentialSource;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EngineHttpClientTest {
  private static final String BASE = "http://engine.example.com";
  private static final String PATH = "/v1/jobs/7";

  private final MutableClock clock = new MutableClock();
  private final StaticCredentialSource source = new StaticCredentialSource(clock);
  private final CredentialManager credentials = new CredentialManager(source, null, clock);
  private final ScriptedInterceptor http = new ScriptedInterceptor();
  private final EngineHttpClient client =
      new EngineHttpClient(OkHttpFactory.authenticated(http.client(), credentials));

  @Test
  @DisplayName("successful calls carry the bearer token and return parsed JSON")
  void success() {
    http.on("GET", PATH, ok("{\"job_id\":7,\"progress\":1}"));

    JsonNode node = client.get(BASE + PATH);

    assertEquals(7, node.path("job_id").asInt());
    assertEquals("Bearer token-1", http.exchanges().get(0).authorization());
  }

  @Test
  @DisplayName("a 401 refreshes the credential and replays the request once")
  void replaysAfterUnauthorized() {
    http.on("GET", PATH, json(401, "{}"), ok("{\"ok\":true}"));

    JsonNode node = client.get(BASE + PATH);

    assertTrue(node.path("ok").asBoolean());
    List<ScriptedInterceptor.Exchange> exchanges = http.exchanges();
    assertEquals(2, exchanges.size());
    assertEquals("Bearer token-1", exchanges.get(0).authorization());
    assertEquals("Bearer token-2", exchanges.get(1).authorization());
    assertEquals(2, source.calls());
  }

  @Test
  @DisplayName("a second rejection is an auth error")
  void persistentForbidden() {
    http.on("GET", PATH, json(403, "{\"errorMessage\":\"forbidden\"}"));

    assertThrows(AuthException.class, () -> client.get(BASE + PATH));
    assertEquals(2, http.count("GET", PATH));
  }

  @Test
  @DisplayName("server errors and throttling are transient")
  void transientStatuses() {
    http.on("GET", PATH, json(503, "unavailable"));
    TransientNetworkException e =
        assertThrows(TransientNetworkException.class, () -> client.get(BASE + PATH));
    assertEquals(503, e.getStatusCode());
    assertTrue(e.isRetryable());

    http.on("POST", "/v1/wcc", json(429, "slow down"));
    assertThrows(TransientNetworkException.class, () -> client.post(BASE + "/v1/wcc", Map.of()));
  }

  @Test
  @DisplayName("I/O failures are transient")
  void ioFailure() {
    http.on("GET", PATH, failure(new SocketTimeoutException("read timed out")));

    TransientNetworkException e =
        assertThrows(TransientNetworkException.class, () -> client.get(BASE + PATH));
    assertEquals(0, e.getStatusCode());
    assertInstanceOf(IOException.class, e.getCause());
  }

  @Test
  @DisplayName("404 maps to not found, other 4xx to request errors")
  void clientErrors() {
    http.on("DELETE", PATH, json(404, "{}"));
    assertThrows(RemoteNotFoundException.class, () -> client.delete(BASE + PATH));

    http.on("POST", "/v1/pagerank", json(400, "{\"errorMessage\":\"bad graph_id\"}"));
    RemoteRequestException e =
        assertThrows(
            RemoteRequestException.class, () -> client.post(BASE + "/v1/pagerank", Map.of()));
    assertEquals(400, e.getStatusCode());
    assertTrue(e.getMessage().contains("bad graph_id"));
  }

  @Test
  @DisplayName("malformed bodies are request errors, empty bodies an empty object")
  void bodies() {
    http.on("GET", PATH, ok("not json"));
    assertThrows(RemoteRequestException.class, () -> client.get(BASE + PATH));

    http.on("DELETE", "/v1/graphs/1", ok(""));
    assertTrue(client.delete(BASE + "/v1/graphs/1").isEmpty());
  }

  @Test
  @DisplayName("POST bodies are serialized as JSON")
  void postBody() {
    http.on("POST", "/v1/wcc", ok("{\"job_id\":\"1\"}"));

    client.post(BASE + "/v1/wcc", Map.of("graph_id", "g1"));
    client.post(BASE + "/v1/wcc", null);

    assertEquals("{}", http.lastBody("POST", "/v1/wcc"));
    assertEquals("{\"graph_id\":\"g1\"}", http.exchanges().get(0).body());
  }
}
