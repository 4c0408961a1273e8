package com.vidly.security;

/**
 * Claim names carried by Vidly auth tokens. The subject ({@code sub}) holds the user id.
 */
public final class TokenClaims {

    public static final String NAME = "name";
    public static final String IS_ADMIN = "isAdmin";

    private TokenClaims() {}
}
