package com.namehub.service;

import com.namehub.ledger.LedgerClient;
import com.namehub.ledger.LedgerOperation;
import com.namehub.model.ConsumedReference;
import com.namehub.model.UserRole;
import com.namehub.model.VerifiedPayment;
import com.namehub.repository.ConsumedReferenceRepository;
import com.namehub.repository.VerifiedPaymentRepository;
import com.namehub.web.RegistryException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Confirms payments against the external ledger and keeps the set of consumed ledger references.
 */
@Service
@RequiredArgsConstructor
public class PaymentVerificationService {

    private static final Logger log = LoggerFactory.getLogger(PaymentVerificationService.class);

    private final LedgerClient ledgerClient;
    private final ConsumedReferenceRepository consumedReferenceRepository;
    private final VerifiedPaymentRepository verifiedPaymentRepository;
    private final AccessControlService accessControlService;

    public boolean isReferenceUsed(String blockReference) {
        return consumedReferenceRepository.existsById(blockReference);
    }

    public boolean verify(String blockReference, long expectedAmount, String expectedRecipient) {
        return verifyTransfer(blockReference, expectedAmount, expectedRecipient).isPresent();
    }

    /**
     * Admin-only dry run of {@link #verify}. Consumes nothing.
     */
    public boolean verifyAsAdmin(String caller, String blockReference, long expectedAmount, String expectedRecipient) {
        accessControlService.requireRole(caller, UserRole.ADMIN);
        return verify(blockReference, expectedAmount, expectedRecipient);
    }

    /**
     * Returns the first transfer under the reference that pays at least the expected amount to the expected
     * recipient, or empty when the reference does not prove payment. Other transfers in the same
     * transaction, such as tips or fee splits, are ignored.
     * The sender is not compared with the registering caller since payments may be relayed.
     * Ledger failures count as an unverified payment.
     */
    public Optional<LedgerClient.LedgerEntry> verifyTransfer(
            String blockReference,
            long expectedAmount,
            String expectedRecipient
    ) {
        List<LedgerClient.LedgerEntry> entries;
        try {
            entries = ledgerClient.findEntries(blockReference);
        } catch (RuntimeException e) {
            log.warn("Ledger lookup failed for {}: {}", blockReference, e.getMessage());
            return Optional.empty();
        }

        if (entries.isEmpty()) {
            log.warn("Ledger has no entry for {}", blockReference);
            return Optional.empty();
        }
        if (expectedRecipient == null) {
            log.warn("No payment recipient configured; cannot verify {}", blockReference);
            return Optional.empty();
        }
        for (LedgerClient.LedgerEntry entry : entries) {
            if (entry.operation() == LedgerOperation.TRANSFER
                    && expectedRecipient.equals(entry.recipient())
                    && entry.amount() >= expectedAmount) {
                log.debug("Ledger entry {} verified: {} from {}", blockReference, entry.amount(), entry.sender());
                return Optional.of(entry);
            }
        }

        boolean anyTransfer = entries.stream().anyMatch(entry -> entry.operation() == LedgerOperation.TRANSFER);
        if (!anyTransfer) {
            log.warn("Ledger entry {} is a {}, not a transfer", blockReference, entries.get(0).operation());
        } else {
            log.warn("Ledger entry {} has no transfer of at least {} to {}", blockReference, expectedAmount, expectedRecipient);
        }
        return Optional.empty();
    }

    /**
     * Marks a reference permanently used. Must run inside the registration commit transaction.
     *
     * @throws RegistryException with REPLAYED_PAYMENT when the reference is already consumed
     */
    public ConsumedReference consume(String blockReference, String consumer, OffsetDateTime consumedAt) {
        if (isReferenceUsed(blockReference)) {
            throw RegistryException.replayedPayment(blockReference);
        }
        ConsumedReference consumed = new ConsumedReference();
        consumed.setBlockReference(blockReference);
        consumed.setConsumedBy(consumer);
        consumed.setConsumedAt(consumedAt);
        try {
            return consumedReferenceRepository.saveAndFlush(consumed);
        } catch (DataIntegrityViolationException ex) {
            log.warn("Concurrent consumption of {} rejected", blockReference);
            throw RegistryException.replayedPayment(blockReference);
        }
    }

    public VerifiedPayment recordPayment(
            String payer,
            LedgerClient.LedgerEntry entry,
            String registeredName,
            OffsetDateTime verifiedAt
    ) {
        VerifiedPayment payment = new VerifiedPayment();
        payment.setPayer(payer);
        payment.setAmount(entry.amount());
        payment.setBlockReference(entry.reference());
        payment.setLedgerSender(entry.sender());
        payment.setRegisteredName(registeredName);
        payment.setVerifiedAt(verifiedAt);
        return verifiedPaymentRepository.saveAndFlush(payment);
    }

    public Optional<VerifiedPayment> findByReference(String blockReference) {
        return verifiedPaymentRepository.findByBlockReference(blockReference);
    }

    public List<VerifiedPayment> paymentHistory(String caller) {
        return verifiedPaymentRepository.findByPayerOrderByVerifiedAtDesc(caller);
    }

    public long totalRevenue() {
        return verifiedPaymentRepository.sumAmount();
    }
}
