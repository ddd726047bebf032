package com.example.support.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Account row owned by the external system of record. Only the identity link is ever written.
 */
@Getter
@Setter
@Entity
@Table(name = "accounts")
public class AccountEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "phone", length = 20)
    private String phone;

    @Column(name = "external_identity", length = 128, unique = true)
    private String externalIdentity;
}
