package com.vidly.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.oauth2.server.resource.web.DefaultBearerTokenResolver;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.util.StringUtils;

/**
 * Resolves the caller token from the {@code x-auth-token} header, falling back to
 * a standard {@code Authorization: Bearer} header when the custom header is absent.
 * Requests matching {@code openRequests} resolve to no token at all.
 */
public class AuthTokenResolver implements BearerTokenResolver {

    public static final String HEADER_NAME = "x-auth-token";

    private final BearerTokenResolver fallback = new DefaultBearerTokenResolver();

    private final RequestMatcher openRequests;

    public AuthTokenResolver(RequestMatcher openRequests) {
        this.openRequests = openRequests;
    }

    @Override
    public String resolve(HttpServletRequest request) {
        if (openRequests.matches(request)) {
            return null;
        }
        String token = request.getHeader(HEADER_NAME);
        if (StringUtils.hasText(token)) {
            return token.trim();
        }
        return fallback.resolve(request);
    }
}
