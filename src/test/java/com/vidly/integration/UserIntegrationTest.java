package com.vidly.integration;

import com.vidly.dto.request.UserRequest;
import com.vidly.dto.response.ErrorResponse;
import com.vidly.dto.response.UserResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class UserIntegrationTest extends AbstractIntegrationTest {

    private static final String BASE_URL = "/api/users";

    @Test
    void me_returnsCallerFromToken() {
        UserResponse created = restTemplate.postForEntity(BASE_URL,
            withToken(new UserRequest("Jane Doe", "Jane@Vidly.com", false), tokens.admin(99L)),
            UserResponse.class).getBody();

        ResponseEntity<UserResponse> response = restTemplate.exchange(BASE_URL + "/me", HttpMethod.GET,
            withToken(tokens.user(created.id())), UserResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().email()).isEqualTo("jane@vidly.com");
        assertThat(response.getBody().isAdmin()).isFalse();
    }

    @Test
    void me_forUnknownSubject_returns404() {
        ResponseEntity<ErrorResponse> response = restTemplate.exchange(BASE_URL + "/me", HttpMethod.GET,
            withToken(tokens.user(12345L)), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void create_asNonAdmin_returns403() {
        ResponseEntity<String> response = restTemplate.postForEntity(BASE_URL,
            withToken(new UserRequest("Jane Doe", "jane@vidly.com", false), tokens.user(1L)), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void create_withDuplicateEmail_returns409() {
        String adminToken = tokens.admin(1L);
        restTemplate.postForEntity(BASE_URL,
            withToken(new UserRequest("Jane Doe", "jane@vidly.com", false), adminToken), UserResponse.class);

        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(BASE_URL,
            withToken(new UserRequest("Jane Again", "JANE@vidly.com", false), adminToken), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }
}
