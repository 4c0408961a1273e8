package com.vidly.config;

import com.vidly.security.AuthTokenResolver;
import com.vidly.security.TokenClaims;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.security.web.util.matcher.AntPathRequestMatcher.antMatcher;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String ROLE_ADMIN = "ADMIN";

    /**
     * Routes open to anonymous callers. Tokens sent to them are not read, so a stale or
     * malformed token cannot turn an open request into a 401.
     */
    public static final RequestMatcher PUBLIC_REQUESTS = new OrRequestMatcher(
        antMatcher("/v3/api-docs/**"),
        antMatcher("/swagger-ui/**"),
        antMatcher("/swagger-ui.html"),
        antMatcher("/actuator/health/**"),
        antMatcher("/error"),
        antMatcher(HttpMethod.GET, "/api/genres/**"),
        antMatcher(HttpMethod.GET, "/api/movies/**"),
        antMatcher("/api/customers/**"),
        antMatcher("/api/rentals/**")
    );

    /**
     * Verifies HS256 tokens against the shared secret from {@code vidly.security.jwt-secret}.
     * Token issuance happens outside this service.
     */
    @Bean
    public JwtDecoder jwtDecoder(VidlyProperties properties) {
        byte[] secret = properties.security().jwtSecret().getBytes(StandardCharsets.UTF_8);
        SecretKey key = new SecretKeySpec(secret, "HmacSHA256");
        return NimbusJwtDecoder.withSecretKey(key)
            .macAlgorithm(MacAlgorithm.HS256)
            .build();
    }

    @Bean
    public BearerTokenResolver bearerTokenResolver() {
        return new AuthTokenResolver(PUBLIC_REQUESTS);
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   BearerTokenResolver bearerTokenResolver) throws Exception {
        http
            .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .csrf(csrf -> csrf.disable())   // stateless token API, no cookies
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(PUBLIC_REQUESTS).permitAll()
                // Catalogue writes: any logged-in user may add or edit, only admins delete
                .requestMatchers(HttpMethod.DELETE, "/api/genres/**", "/api/movies/**").hasRole(ROLE_ADMIN)
                .requestMatchers(HttpMethod.POST, "/api/genres/**", "/api/movies/**").authenticated()
                .requestMatchers(HttpMethod.PUT, "/api/genres/**", "/api/movies/**").authenticated()
                .requestMatchers("/api/returns/**").authenticated()
                .requestMatchers(HttpMethod.GET, "/api/users/me").authenticated()
                .requestMatchers("/api/users/**").hasRole(ROLE_ADMIN)
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth2 -> oauth2
                .bearerTokenResolver(bearerTokenResolver)
                .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter()))
            );

        return http.build();
    }

    @Bean
    public JwtAuthenticationConverter jwtAuthenticationConverter() {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setJwtGrantedAuthoritiesConverter(jwt -> {
            List<GrantedAuthority> authorities = new ArrayList<>();
            authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
            if (Boolean.TRUE.equals(jwt.getClaimAsBoolean(TokenClaims.IS_ADMIN))) {
                authorities.add(new SimpleGrantedAuthority("ROLE_" + ROLE_ADMIN));
            }
            return authorities;
        });
        return converter;
    }
}
