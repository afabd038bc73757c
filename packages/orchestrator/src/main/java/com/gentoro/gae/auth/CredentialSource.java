package com.gentoro.gae.auth;

/**
 * Produces a fresh {@link Credential} on demand. Implementations are called only from inside the
 * {@link CredentialManager} refresh section and may block (process execution, HTTP login).
 */
public interface CredentialSource {

  /**
   * Obtain a new credential.
   *
   * @throws com.gentoro.gae.exception.AuthException when no credential can be produced
   */
  Credential obtain();

  /** Short description for logs. Must not contain secrets. */
  String describe();
}
