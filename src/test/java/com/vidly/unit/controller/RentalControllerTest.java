package com.vidly.unit.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidly.config.PropertiesConfig;
import com.vidly.config.SecurityConfig;
import com.vidly.controller.RentalController;
import com.vidly.dto.request.RentalRequest;
import com.vidly.dto.response.RentalResponse;
import com.vidly.exception.InvalidReferenceException;
import com.vidly.exception.OutOfStockException;
import com.vidly.exception.RentalTransactionException;
import com.vidly.exception.ResourceNotFoundException;
import com.vidly.security.AuthTokenResolver;
import com.vidly.service.RentalService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RentalController.class)
@Import({SecurityConfig.class, PropertiesConfig.class})
class RentalControllerTest {

    private static final String BASE_URL = "/api/rentals";
    private static final Instant DATE_OUT = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RentalService rentalService;

    @Test
    void create_withValidBody_returns200WithRental() throws Exception {
        when(rentalService.create(any(RentalRequest.class))).thenReturn(sampleRental());

        mockMvc.perform(post(BASE_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RentalRequest(1L, 2L, DATE_OUT, null, null))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(10))
            .andExpect(jsonPath("$.customer.name").value("Jane Doe"))
            .andExpect(jsonPath("$.movie.title").value("Terminator"))
            .andExpect(jsonPath("$.movie.dailyRentalRate").value(2.5));
    }

    @Test
    void create_withMissingMovieId_returns400WithFirstMessage() throws Exception {
        mockMvc.perform(post(BASE_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                    Map.of("customerId", 1, "dateOut", DATE_OUT.toString()))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Movie ID is required"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("movieId"));

        verifyNoInteractions(rentalService);
    }

    @Test
    void create_withEmptyBody_reportsErrorsInDeclarationOrder() throws Exception {
        mockMvc.perform(post(BASE_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Customer ID is required"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("customerId"))
            .andExpect(jsonPath("$.fieldErrors[1].field").value("movieId"))
            .andExpect(jsonPath("$.fieldErrors[2].field").value("dateOut"));

        verifyNoInteractions(rentalService);
    }

    @Test
    void create_withRentalFeeTooLargeForColumn_returns400() throws Exception {
        var request = new RentalRequest(1L, 2L, DATE_OUT, null, new BigDecimal("123456789012.34"));

        mockMvc.perform(post(BASE_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Rental fee must have at most 8 digits and 2 decimals"));

        verifyNoInteractions(rentalService);
    }

    @Test
    void update_withRentalFeeOfThreeDecimals_returns400() throws Exception {
        var request = new RentalRequest(1L, 2L, DATE_OUT, null, new BigDecimal("4.125"));

        mockMvc.perform(put(BASE_URL + "/10")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.fieldErrors[0].field").value("rentalFee"));

        verifyNoInteractions(rentalService);
    }

    @Test
    void findAll_withMalformedToken_ignoresTokenAndReturns200() throws Exception {
        when(rentalService.findAll()).thenReturn(List.of(sampleRental()));

        mockMvc.perform(get(BASE_URL).header(AuthTokenResolver.HEADER_NAME, "garbage"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(10));
    }

    @Test
    void create_withMalformedToken_ignoresTokenAndReturns200() throws Exception {
        when(rentalService.create(any(RentalRequest.class))).thenReturn(sampleRental());

        mockMvc.perform(post(BASE_URL)
                .header(AuthTokenResolver.HEADER_NAME, "garbage")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RentalRequest(1L, 2L, DATE_OUT, null, null))))
            .andExpect(status().isOk());
    }

    @Test
    void create_withMalformedBody_returns400() throws Exception {
        mockMvc.perform(post(BASE_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"customerId\": "))
            .andExpect(status().isBadRequest());
    }

    @Test
    void create_withUnknownCustomer_returns400() throws Exception {
        when(rentalService.create(any(RentalRequest.class))).thenThrow(new InvalidReferenceException("customer"));

        mockMvc.perform(post(BASE_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RentalRequest(99L, 2L, DATE_OUT, null, null))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid customer."));
    }

    @Test
    void create_whenOutOfStock_returns400() throws Exception {
        when(rentalService.create(any(RentalRequest.class))).thenThrow(new OutOfStockException(2L));

        mockMvc.perform(post(BASE_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RentalRequest(1L, 2L, DATE_OUT, null, null))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Movie not in stock."));
    }

    @Test
    void create_whenTransactionFails_returns500WithoutStoreDetails() throws Exception {
        when(rentalService.create(any(RentalRequest.class)))
            .thenThrow(new RentalTransactionException(2L, new QueryTimeoutException("statement timeout on movies")));

        mockMvc.perform(post(BASE_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RentalRequest(1L, 2L, DATE_OUT, null, null))))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("Something failed."))
            .andExpect(content().string(not(containsString("statement timeout"))));
    }

    @Test
    void findById_withNonNumericId_returns404() throws Exception {
        mockMvc.perform(get(BASE_URL + "/abc"))
            .andExpect(status().isNotFound());

        verifyNoInteractions(rentalService);
    }

    @Test
    void findById_whenMissing_returns404() throws Exception {
        when(rentalService.findById(42L)).thenThrow(new ResourceNotFoundException("Rental", 42L));

        mockMvc.perform(get(BASE_URL + "/42"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Rental not found with id 42"));
    }

    @Test
    void delete_returnsDeletedRental() throws Exception {
        when(rentalService.delete(10L)).thenReturn(sampleRental());

        mockMvc.perform(delete(BASE_URL + "/10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(10));
    }

    private RentalResponse sampleRental() {
        return new RentalResponse(
            10L,
            new RentalResponse.CustomerSummary(1L, "Jane Doe"),
            new RentalResponse.MovieSummary(2L, "Terminator", new BigDecimal("2.50")),
            DATE_OUT,
            null,
            null
        );
    }
}
