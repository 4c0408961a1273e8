package com.vidly.integration;

import com.vidly.dto.request.CustomerRequest;
import com.vidly.dto.response.CustomerResponse;
import com.vidly.dto.response.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CustomerIntegrationTest extends AbstractIntegrationTest {

    private static final String BASE_URL = "/api/customers";

    @Test
    void fullCrudLifecycle() {
        ResponseEntity<CustomerResponse> created = restTemplate.postForEntity(
            BASE_URL, new CustomerRequest("Jane Doe", "555-0100", true), CustomerResponse.class);

        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.OK);
        Long customerId = created.getBody().id();
        assertThat(created.getBody().isGold()).isTrue();

        ResponseEntity<CustomerResponse> updated = restTemplate.exchange(BASE_URL + "/" + customerId,
            HttpMethod.PUT, new HttpEntity<>(new CustomerRequest("Jane Smith", "555-0199", false)),
            CustomerResponse.class);

        assertThat(updated.getBody().name()).isEqualTo("Jane Smith");
        assertThat(updated.getBody().isGold()).isFalse();

        ResponseEntity<CustomerResponse> deleted = restTemplate.exchange(
            BASE_URL + "/" + customerId, HttpMethod.DELETE, null, CustomerResponse.class);
        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.OK);

        assertThat(restTemplate.getForEntity(BASE_URL + "/" + customerId, ErrorResponse.class).getStatusCode())
            .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void create_readsIsGoldFromJson() {
        ResponseEntity<CustomerResponse> created = restTemplate.postForEntity(BASE_URL,
            new HttpEntity<>(Map.of("name", "Jane Doe", "phone", "555-0100", "isGold", true)),
            CustomerResponse.class);

        assertThat(created.getBody().isGold()).isTrue();
    }

    @Test
    void create_withShortPhone_returns400() {
        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(
            BASE_URL, new CustomerRequest("Jane Doe", "123", false), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().message()).isEqualTo("Phone must be between 5 and 50 characters");
    }
}
