package com.gentoro.gae.engine;

import com.gentoro.gae.auth.CommandCredentialSource;
import com.gentoro.gae.auth.CredentialSource;
import com.gentoro.gae.auth.LoginCredentialSource;
import com.gentoro.gae.auth.PreIssuedTokenCredentialSource;
import com.gentoro.gae.config.OrchestratorSettings;
import com.gentoro.gae.http.EngineHttpClient;
import com.gentoro.gae.store.DocumentStore;
import com.gentoro.gae.utility.Sleeper;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.StringUtils;

/** Selects backend and credential source from the configured deployment mode. */
public final class EngineConnectionFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(EngineConnectionFactory.class);

  private EngineConnectionFactory() {}

  /**
   * @param plainClient client without bearer authentication, used for the database login
   */
  public static CredentialSource credentialSource(
      OrchestratorSettings settings, OkHttpClient plainClient, Clock clock) {
    return switch (settings.mode()) {
      case MANAGED -> managedCredentialSource(settings, clock);
      case SELF_HOSTED ->
          new LoginCredentialSource(
              plainClient,
              settings.selfHostedEndpoint(),
              settings.selfHostedUser(),
              settings.selfHostedPassword(),
              settings.credentialValidity(),
              clock);
    };
  }

  private static CredentialSource managedCredentialSource(
      OrchestratorSettings settings, Clock clock) {
    CredentialSource keyLogin = null;
    if (StringUtils.isNotBlank(settings.managedApiKeyId())
        && StringUtils.isNotBlank(settings.managedApiKeySecret())) {
      List<String> command = Arrays.asList(settings.managedLoginCommand().trim().split("\\s+"));
      keyLogin =
          new CommandCredentialSource(
              command,
              settings.managedApiKeyId(),
              settings.managedApiKeySecret(),
              settings.credentialValidity(),
              CommandCredentialSource.DEFAULT_TIMEOUT,
              clock);
    }
    if (StringUtils.isNotBlank(settings.managedAccessToken())) {
      log.debug("Managed mode starts with the configured access token");
      return new PreIssuedTokenCredentialSource(
          settings.managedAccessToken(), settings.credentialValidity(), keyLogin, clock);
    }
    return keyLogin;
  }

  /**
   * @param authenticatedClient client carrying the bearer-auth interceptor
   * @param documentStore used by the managed backend to resolve named graphs; may be {@code null}
   */
  public static EngineConnection create(
      OrchestratorSettings settings,
      OkHttpClient authenticatedClient,
      DocumentStore documentStore,
      Clock clock,
      Sleeper sleeper) {
    EngineHttpClient http = new EngineHttpClient(authenticatedClient);
    EngineConnection connection =
        switch (settings.mode()) {
          case MANAGED ->
              new ManagedEngineConnection(http, settings, documentStore, clock, sleeper);
          case SELF_HOSTED -> new SelfHostedEngineConnection(http, settings, clock, sleeper);
        };
    log.info("Using {} engine backend", settings.mode().id());
    return connection;
  }
}
