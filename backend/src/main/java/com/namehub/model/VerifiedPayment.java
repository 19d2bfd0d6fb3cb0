package com.namehub.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "verified_payment")
public class VerifiedPayment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 128)
    private String payer;

    @Column(nullable = false, updatable = false)
    private Long amount;

    @Column(name = "block_reference", nullable = false, updatable = false, unique = true, length = 128)
    private String blockReference;

    /**
     * Sender recorded on the ledger; may differ from the payer when a relay wallet paid.
     */
    @Column(name = "ledger_sender", length = 128)
    private String ledgerSender;

    @Column(name = "registered_name", length = NameRecord.MAX_NAME_LENGTH)
    private String registeredName;

    @Column(name = "verified_at", nullable = false, updatable = false)
    private OffsetDateTime verifiedAt = OffsetDateTime.now();
}
