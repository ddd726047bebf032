package com.example.support.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "stores")
public class StoreEntity {

    static final String EXPRESS_KIND = "express";

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 255)
    private String id;

    @Column(name = "title", length = 255)
    private String title;

    @Column(name = "kind", length = 255)
    private String kind;

    @Column(name = "street", length = 255)
    private String street;

    /**
     * Express stores are known to customers by their street.
     */
    public String displayTitle() {
        return EXPRESS_KIND.equals(kind) ? street : title;
    }
}
