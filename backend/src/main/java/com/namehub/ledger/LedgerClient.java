package com.namehub.ledger;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Read access to the external payment ledger.
 */
public interface LedgerClient {

    /**
     * Looks up the ledger entries recorded under a reference. One reference may carry several
     * transfers, for example a tip ahead of the actual payment.
     *
     * @param reference ledger reference (transaction signature) supplied by the payer
     * @return the recorded entries in ledger order, or an empty list when no successful entry exists
     * @throws LedgerUnavailableException when the ledger cannot be queried
     */
    List<LedgerEntry> findEntries(String reference);

    /**
     * Cheap liveness query used by the health endpoint.
     *
     * @throws LedgerUnavailableException when the ledger cannot be queried
     */
    LedgerProbe probe();

    record LedgerEntry(
            String reference,
            LedgerOperation operation,
            String sender,
            String recipient,
            long amount,
            long height,
            OffsetDateTime recordedAt
    ) {
    }

    record LedgerProbe(
            String latestHash,
            long height
    ) {
    }
}
