package com.gentoro.gae.auth;

import com.gentoro.gae.exception.AuthException;
import com.gentoro.gae.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;

/**
 * Obtains a token by running the platform login CLI ({@code <command> login --key-id ID
 * --key-secret SECRET}) and reading the token from its standard output.
 *
 * <p>The process is started without a shell. Key material containing shell metacharacters is
 * still rejected up front.
 */
public class CommandCredentialSource implements CredentialSource {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(CommandCredentialSource.class);

  static final String FORBIDDEN_CHARS = ";&|`$()<>";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  private final List<String> command;
  private final String keyId;
  private final String keySecret;
  private final Duration validity;
  private final Duration timeout;
  private final Clock clock;

  public CommandCredentialSource(
      String command, String keyId, String keySecret, Duration validity, Clock clock) {
    this(List.of(command), keyId, keySecret, validity, DEFAULT_TIMEOUT, clock);
  }

  /**
   * @param command executable plus any leading arguments; {@code login --key-id .. --key-secret
   *     ..} is appended
   */
  public CommandCredentialSource(
      List<String> command,
      String keyId,
      String keySecret,
      Duration validity,
      Duration timeout,
      Clock clock) {
    if (command == null || command.isEmpty() || StringUtils.isBlank(command.get(0))) {
      throw new ConfigException("Login command must not be empty");
    }
    this.command = List.copyOf(command);
    this.keyId = requireSafe("API key id", keyId);
    this.keySecret = requireSafe("API key secret", keySecret);
    this.validity = validity;
    this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  private static String requireSafe(String what, String value) {
    if (StringUtils.isBlank(value)) {
      throw new ConfigException(what + " is required");
    }
    if (StringUtils.containsAny(value, FORBIDDEN_CHARS)) {
      throw new ConfigException(what + " contains invalid characters");
    }
    return value.trim();
  }

  @Override
  public Credential obtain() {
    List<String> args = new ArrayList<>(command);
    args.add("login");
    args.add("--key-id");
    args.add(keyId);
    args.add("--key-secret");
    args.add(keySecret);

    Process process;
    try {
      process = new ProcessBuilder(args).start();
    } catch (IOException e) {
      throw new AuthException(
          "Could not start login command '" + command.get(0) + "'. Is it installed?", e);
    }

    // pipes are read while the process runs, not after it exits
    CompletableFuture<String> stdout = drain(process.getInputStream());
    CompletableFuture<String> stderr = drain(process.getErrorStream());
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new AuthException("Login command did not finish within " + timeout);
      }
      if (process.exitValue() != 0) {
        throw new AuthException(
            "Login command exited with %d: %s"
                .formatted(process.exitValue(), stderr.join().trim()));
      }
      String token = stdout.join().trim();
      if (token.isEmpty()) {
        throw new AuthException("Login command returned an empty token");
      }
      log.debug("Obtained token from login command '{}'", command.get(0));
      return new Credential(token, clock.instant(), validity);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new AuthException("Interrupted while waiting for login command", e);
    } catch (CompletionException e) {
      throw new AuthException("Failed to read login command output", e.getCause());
    }
  }

  private static CompletableFuture<String> drain(InputStream stream) {
    return CompletableFuture.supplyAsync(
        () -> {
          try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        });
  }

  @Override
  public String describe() {
    return "login command '" + command.get(0) + "'";
  }
}
