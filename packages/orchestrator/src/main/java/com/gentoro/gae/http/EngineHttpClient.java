package com.gentoro.gae.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gae.exception.AuthException;
import com.gentoro.gae.exception.RemoteNotFoundException;
import com.gentoro.gae.exception.RemoteRequestException;
import com.gentoro.gae.exception.TransientNetworkException;
import com.gentoro.gae.utility.JacksonUtility;
import java.io.IOException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;

/**
 * JSON-over-HTTP calls against the management and engine APIs. Every failure is mapped onto the
 * orchestrator's error taxonomy:
 *
 * <ul>
 *   <li>I/O failure, 5xx, 408, 429: {@link TransientNetworkException}
 *   <li>401, 403 (after the auth interceptor's single replay): {@link AuthException}
 *   <li>404: {@link RemoteNotFoundException}
 *   <li>other 4xx, unparseable body: {@link RemoteRequestException}
 * </ul>
 */
public class EngineHttpClient {
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final int MAX_ERROR_BODY = 300;

  private final OkHttpClient client;

  public EngineHttpClient(OkHttpClient client) {
    this.client = client;
  }

  public JsonNode get(String url) {
    return execute(new Request.Builder().url(url).get().build());
  }

  public JsonNode post(String url, Object body) {
    String json = body == null ? "{}" : JacksonUtility.toJson(body);
    return execute(new Request.Builder().url(url).post(RequestBody.create(json, JSON)).build());
  }

  public JsonNode delete(String url) {
    return execute(new Request.Builder().url(url).delete().build());
  }

  private JsonNode execute(Request request) {
    String call = request.method() + " " + request.url().encodedPath();
    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      int code = response.code();
      if (!response.isSuccessful()) {
        throw classify(call, code, text);
      }
      if (StringUtils.isBlank(text)) {
        return JacksonUtility.getJsonMapper().createObjectNode();
      }
      try {
        return JacksonUtility.getJsonMapper().readTree(text);
      } catch (JsonProcessingException e) {
        throw new RemoteRequestException(call + " returned a malformed JSON body", e);
      }
    } catch (IOException e) {
      throw new TransientNetworkException(call + " failed: " + describe(e), e);
    }
  }

  static RuntimeException classify(String call, int code, String body) {
    String message =
        "%s returned HTTP %d: %s"
            .formatted(call, code, StringUtils.abbreviate(body, MAX_ERROR_BODY));
    if (code >= 500 || code == 408 || code == 429) {
      return new TransientNetworkException(message, code);
    }
    if (code == 401 || code == 403) {
      return new AuthException(message);
    }
    if (code == 404) {
      return new RemoteNotFoundException(message);
    }
    return new RemoteRequestException(message, code);
  }

  private static String describe(IOException e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
