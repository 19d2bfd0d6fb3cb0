package com.namehub.ledger;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MockLedgerClientTest {

    private final MockLedgerClient ledgerClient = new MockLedgerClient();

    @Test
    void recordedTransferIsFoundByReference() {
        ledgerClient.recordTransfer("sig-1", "payer", "treasury", 500L);

        List<LedgerClient.LedgerEntry> entries = ledgerClient.findEntries("sig-1");

        assertEquals(1, entries.size());
        LedgerClient.LedgerEntry entry = entries.get(0);

        assertEquals(LedgerOperation.TRANSFER, entry.operation());
        assertEquals("treasury", entry.recipient());
        assertEquals(500L, entry.amount());
        assertEquals(1L, entry.height());
        assertTrue(ledgerClient.findEntries("sig-2").isEmpty());
    }

    @Test
    void repeatedRecordingUnderOneReferenceKeepsEveryEntryInOrder() {
        ledgerClient.recordTransfer("sig-1", "payer", "validator-tip", 5L);
        ledgerClient.recordTransfer("sig-1", "payer", "treasury", 500L);

        List<LedgerClient.LedgerEntry> entries = ledgerClient.findEntries("sig-1");

        assertEquals(2, entries.size());
        assertEquals("validator-tip", entries.get(0).recipient());
        assertEquals("treasury", entries.get(1).recipient());
    }

    @Test
    void offlineLedgerThrowsUntilCleared() {
        ledgerClient.setAvailable(false);

        assertThrows(LedgerUnavailableException.class, () -> ledgerClient.findEntries("sig-1"));
        assertThrows(LedgerUnavailableException.class, ledgerClient::probe);

        ledgerClient.clear();

        assertEquals(0L, ledgerClient.probe().height());
    }
}
