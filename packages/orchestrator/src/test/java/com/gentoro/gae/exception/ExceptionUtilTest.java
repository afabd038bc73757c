package com.gentoro.gae.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  @DisplayName("orchestrator exceptions keep their code and context")
  void fromGaeException() {
    GaeException e = new ConfigException("target collection is required").withContext("n", 1);

    ErrorDetails details = ExceptionUtil.toErrorDetails(e);

    assertEquals("ConfigException", details.type());
    assertEquals(GaeErrorCode.CONFIG_ERROR, details.code());
    assertEquals(1, details.context().get("n"));
    assertEquals("CONFIG_ERROR: target collection is required", details.toDisplayString());
  }

  @Test
  @DisplayName("foreign throwables are classified by type")
  void classifiesForeignThrowables() {
    assertEquals(
        GaeErrorCode.TRANSIENT_NETWORK_ERROR, ExceptionUtil.classify(new IOException("reset")));
    assertEquals(GaeErrorCode.CONFIG_ERROR, ExceptionUtil.classify(new IllegalArgumentException()));
    assertEquals(GaeErrorCode.UNKNOWN, ExceptionUtil.classify(new IllegalStateException()));
    assertNull(ExceptionUtil.toErrorDetails(new IllegalStateException("x")).context());
  }

  @Test
  @DisplayName("messages fall back to the first cause that has one")
  void extractErrorMessage() {
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
    assertEquals("boom", ExceptionUtil.extractErrorMessage(new RuntimeException("  boom ")));
    Throwable nested =
        new RuntimeException(null, new IllegalStateException(null, new IOException("closed")));
    assertEquals("RuntimeException: closed", ExceptionUtil.extractErrorMessage(nested));
    assertEquals(
        "IllegalStateException", ExceptionUtil.extractErrorMessage(new IllegalStateException()));
  }
}
