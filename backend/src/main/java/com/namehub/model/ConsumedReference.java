package com.namehub.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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

/**
 * Anti-replay marker. A row here means the ledger transaction can never fund another registration.
 */
@Getter
@Setter
@Entity
@Table(name = "consumed_reference")
public class ConsumedReference implements Persistable<String> {

    public static final int MAX_REFERENCE_LENGTH = 128;

    @Id
    @Column(name = "block_reference", nullable = false, updatable = false, length = MAX_REFERENCE_LENGTH)
    private String blockReference;

    @Column(name = "consumed_by", nullable = false, updatable = false, length = 128)
    private String consumedBy;

    @Column(name = "consumed_at", nullable = false, updatable = false)
    private OffsetDateTime consumedAt = OffsetDateTime.now();

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean fresh = true;

    @Override
    public String getId() {
        return blockReference;
    }

    /**
     * Always inserted, never merged, so a concurrent duplicate surfaces as a key violation.
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
