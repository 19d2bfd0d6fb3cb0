package com.namehub.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "name_record")
public class NameRecord implements Persistable<String> {

    /**
     * Width of the {@code name} columns. Season name-length limits may not exceed it.
     */
    public static final int MAX_NAME_LENGTH = 64;

    public static final int MAX_ADDRESS_LENGTH = 128;

    @Id
    @Column(nullable = false, updatable = false, length = MAX_NAME_LENGTH)
    private String name;

    @Column(nullable = false, length = MAX_ADDRESS_LENGTH)
    private String address;

    @Enumerated(EnumType.STRING)
    @Column(name = "address_type", nullable = false, length = 32)
    private AddressType addressType;

    @Column(nullable = false, updatable = false, unique = true, length = 128)
    private String owner;

    @Column(name = "season_id", nullable = false, updatable = false)
    private Long seasonId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean fresh = true;

    @Override
    public String getId() {
        return name;
    }

    /**
     * New instances are always inserted, never merged, so a concurrent duplicate surfaces as a key
     * violation. Loaded records are merged as usual.
     */
    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        fresh = false;
    }
}
