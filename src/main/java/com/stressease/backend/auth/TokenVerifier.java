package com.stressease.backend.auth;

/**
 * Turns an opaque bearer credential into the stable subject id it was issued to.
 */
public interface TokenVerifier {

    /**
     * @throws com.stressease.backend.exception.UnauthorizedException when the token is rejected
     */
    String verify(String token);
}
