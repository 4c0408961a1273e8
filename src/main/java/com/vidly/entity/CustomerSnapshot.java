package com.vidly.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Customer data copied into a {@link Rental} when it is created.
 *
 * <p>The values are a point-in-time copy, not a reference: there is no foreign key to
 * {@code customers}, and deleting or renaming the customer leaves the rental unchanged.
 * Instances are immutable; updating a rental replaces the whole snapshot.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerSnapshot {

    @Column(name = "customer_id", nullable = false)
    private Long id;

    @Column(name = "customer_name", nullable = false, length = 50)
    private String name;

    public static CustomerSnapshot of(Customer customer) {
        return new CustomerSnapshot(customer.getId(), customer.getName());
    }
}
