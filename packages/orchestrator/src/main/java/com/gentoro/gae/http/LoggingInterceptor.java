package com.gentoro.gae.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/**
 * Logs every exchange at DEBUG (method, URL, status, duration) and request bodies at TRACE.
 * Headers are never logged, and login bodies are redacted.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("-> {} {}", request.method(), request.url());
    if (log.isTraceEnabled() && request.body() != null) {
      log.trace("Request body:\n{}", bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (IOException e) {
      String errorMessage = e.getMessage();
      if (errorMessage == null || errorMessage.isEmpty()) {
        errorMessage = e.getClass().getSimpleName();
      }
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          errorMessage);
      throw e;
    }

    log.debug(
        "<- {} {} {} ({}ms)",
        response.code(),
        request.method(),
        request.url(),
        elapsedMs(startTime));
    return response;
  }

  private static long elapsedMs(long startTime) {
    return (System.nanoTime() - startTime) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    if (request.url().encodedPath().endsWith("/_open/auth")) {
      return "(redacted)";
    }
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
