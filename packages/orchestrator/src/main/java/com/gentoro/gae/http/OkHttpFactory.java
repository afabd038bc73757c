package com.gentoro.gae.http;

import com.gentoro.gae.auth.CredentialManager;
import com.gentoro.gae.config.OrchestratorSettings;
import java.time.Duration;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /** Plain client with request logging; no authentication. */
  public static OkHttpClient create(OrchestratorSettings settings) {
    return create(settings.httpConnectTimeout(), settings.httpReadTimeout());
  }

  public static OkHttpClient create(
      Duration connectTimeout, Duration readTimeout, Interceptor... extra) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .writeTimeout(readTimeout)
            .retryOnConnectionFailure(false);
    for (Interceptor interceptor : extra) {
      builder.addInterceptor(interceptor);
    }
    return builder.addInterceptor(new LoggingInterceptor()).build();
  }

  /**
   * Derive a client that sends the current bearer credential with every request. The auth
   * interceptor runs ahead of logging so the logged exchange is the one actually sent.
   */
  public static OkHttpClient authenticated(OkHttpClient base, CredentialManager credentials) {
    OkHttpClient.Builder builder = base.newBuilder();
    builder.interceptors().add(0, new AuthInterceptor(credentials));
    return builder.build();
  }
}
