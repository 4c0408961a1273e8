package com.vidly.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A store operator account. The id is the {@code sub} claim of the caller's auth token.
 *
 * <p>Credentials are not stored here; tokens are issued by an external identity service
 * that shares the signing secret.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class User extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 50)
    private String name;

    /** Unique, enforced by {@code idx_users_email} (V4). */
    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "is_admin", nullable = false)
    private boolean admin;
}
