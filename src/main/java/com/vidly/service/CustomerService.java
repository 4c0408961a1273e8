package com.vidly.service;

import com.vidly.dto.request.CustomerRequest;
import com.vidly.dto.response.CustomerResponse;
import com.vidly.entity.Customer;
import com.vidly.exception.ResourceNotFoundException;
import com.vidly.mapper.CustomerMapper;
import com.vidly.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class CustomerService {

    private final CustomerRepository customerRepository;

    @Transactional(readOnly = true)
    public List<CustomerResponse> findAll() {
        return customerRepository.findAll(Sort.by("name")).stream()
            .map(CustomerMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public CustomerResponse findById(Long id) {
        return CustomerMapper.toResponse(findCustomer(id));
    }

    @Transactional
    public CustomerResponse create(CustomerRequest request) {
        Customer saved = customerRepository.save(CustomerMapper.toEntity(request));
        return CustomerMapper.toResponse(saved);
    }

    @Transactional
    public CustomerResponse update(Long id, CustomerRequest request) {
        Customer customer = findCustomer(id);
        CustomerMapper.updateEntity(customer, request);
        return CustomerMapper.toResponse(customerRepository.save(customer));
    }

    /** Existing rentals keep their snapshot of the customer. */
    @Transactional
    public CustomerResponse delete(Long id) {
        Customer customer = findCustomer(id);
        customerRepository.delete(customer);
        return CustomerMapper.toResponse(customer);
    }

    private Customer findCustomer(Long id) {
        return customerRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", id));
    }
}
