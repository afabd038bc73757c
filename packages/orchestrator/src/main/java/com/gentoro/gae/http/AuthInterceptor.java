package com.gentoro.gae.http;

import com.gentoro.gae.auth.Credential;
import com.gentoro.gae.auth.CredentialManager;
import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Adds {@code Authorization: Bearer <token>}. When the remote answers 401 or 403 the credential is
 * refreshed once and the request replayed; a second rejection is returned to the caller as is.
 */
public class AuthInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(AuthInterceptor.class);

  private final CredentialManager credentials;

  public AuthInterceptor(CredentialManager credentials) {
    if (credentials == null) {
      throw new IllegalArgumentException("CredentialManager cannot be null");
    }
    this.credentials = credentials;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    Credential credential = credentials.getCredential();
    Response response = chain.proceed(withBearer(original, credential));
    if (response.code() != 401 && response.code() != 403) {
      return response;
    }
    log.debug(
        "{} {} answered {}, refreshing credential and replaying once",
        original.method(),
        original.url(),
        response.code());
    response.close();
    Credential fresh = credentials.refreshIfCurrent(credential);
    return chain.proceed(withBearer(original, fresh));
  }

  private static Request withBearer(Request request, Credential credential) {
    return request.newBuilder().header("Authorization", "Bearer " + credential.token()).build();
  }
}
