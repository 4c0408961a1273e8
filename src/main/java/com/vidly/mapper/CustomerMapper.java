package com.vidly.mapper;

import com.vidly.dto.request.CustomerRequest;
import com.vidly.dto.response.CustomerResponse;
import com.vidly.entity.Customer;

public final class CustomerMapper {

    private CustomerMapper() {}

    public static Customer toEntity(CustomerRequest request) {
        Customer customer = new Customer();
        updateEntity(customer, request);
        return customer;
    }

    public static CustomerResponse toResponse(Customer customer) {
        return new CustomerResponse(
            customer.getId(),
            customer.getName(),
            customer.getPhone(),
            customer.isGold(),
            customer.getCreatedAt(),
            customer.getUpdatedAt()
        );
    }

    /** Full replacement: an omitted {@code isGold} resets the flag to {@code false}. */
    public static void updateEntity(Customer customer, CustomerRequest request) {
        customer.setName(request.name().trim());
        customer.setPhone(request.phone().trim());
        customer.setGold(Boolean.TRUE.equals(request.isGold()));
    }
}
