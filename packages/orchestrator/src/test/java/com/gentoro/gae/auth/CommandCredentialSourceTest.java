package com.gentoro.gae.auth;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gae.exception.AuthException;
import com.gentoro.gae.exception.ConfigException;
import com.gentoro.gae.support.MutableClock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandCredentialSourceTest {
  private final MutableClock clock = new MutableClock();

  private CommandCredentialSource source(List<String> command) {
    return new CommandCredentialSource(
        command, "key-id", "key-secret", Duration.ofHours(24), Duration.ofSeconds(10), clock);
  }

  @Test
  @DisplayName("the token is read from standard output")
  void readsToken() {
    // the appended login arguments land in $1.. and are ignored by the script
    Credential credential =
        source(List.of("sh", "-c", "printf 'tok-123\\n'", "sh")).obtain();

    assertEquals("tok-123", credential.token());
    assertEquals(clock.instant(), credential.issuedAt());
    assertEquals(Duration.ofHours(24), credential.validity());
  }

  @Test
  @DisplayName("the key id and secret are passed as login arguments")
  void passesArguments() {
    Credential credential = source(List.of("echo")).obtain();

    assertEquals("login --key-id key-id --key-secret key-secret", credential.token());
  }

  @Test
  @DisplayName("output larger than a pipe buffer does not stall the login")
  void largeOutput() {
    String script =
        "head -c 300000 /dev/zero | tr '\\0' w >&2; "
            + "head -c 300000 /dev/zero | tr '\\0' ' '; printf 'tok-big\\n'";

    Credential credential = source(List.of("sh", "-c", script, "sh")).obtain();

    assertEquals("tok-big", credential.token());
  }

  @Test
  @DisplayName("a non-zero exit is an auth error")
  void nonZeroExit() {
    AuthException e =
        assertThrows(
            AuthException.class,
            () -> source(List.of("sh", "-c", "echo denied >&2; exit 3", "sh")).obtain());
    assertTrue(e.getMessage().contains("exited with 3"));
    assertTrue(e.getMessage().contains("denied"));
  }

  @Test
  @DisplayName("empty output is an auth error")
  void emptyOutput() {
    assertThrows(AuthException.class, () -> source(List.of("true")).obtain());
  }

  @Test
  @DisplayName("a missing executable is an auth error")
  void missingCommand() {
    assertThrows(
        AuthException.class, () -> source(List.of("gae-no-such-login-command")).obtain());
  }

  @Test
  @DisplayName("key material with shell metacharacters is rejected up front")
  void forbiddenCharacters() {
    assertThrows(
        ConfigException.class,
        () ->
            new CommandCredentialSource(
                "oasisctl", "id; rm -rf /", "secret", Duration.ofHours(1), clock));
    assertThrows(
        ConfigException.class,
        () ->
            new CommandCredentialSource(
                "oasisctl", "id", "$(whoami)", Duration.ofHours(1), clock));
  }
}
