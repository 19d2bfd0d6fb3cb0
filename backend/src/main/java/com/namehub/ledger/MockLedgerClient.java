package com.namehub.ledger;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory ledger for local runs and tests. Entries are recorded explicitly before they can be verified;
 * recording again under the same reference appends another entry.
 */
@Component
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockLedgerClient implements LedgerClient {

    private final Map<String, List<LedgerEntry>> entries = new ConcurrentHashMap<>();
    private final AtomicLong height = new AtomicLong();
    private volatile boolean available = true;

    public LedgerEntry recordTransfer(String reference, String sender, String recipient, long amount) {
        return record(reference, LedgerOperation.TRANSFER, sender, recipient, amount);
    }

    public LedgerEntry record(
            String reference,
            LedgerOperation operation,
            String sender,
            String recipient,
            long amount
    ) {
        LedgerEntry entry = new LedgerEntry(
                reference,
                operation,
                sender,
                recipient,
                amount,
                height.incrementAndGet(),
                OffsetDateTime.now(ZoneOffset.UTC)
        );
        entries.computeIfAbsent(reference, key -> new CopyOnWriteArrayList<>()).add(entry);
        return entry;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void clear() {
        entries.clear();
        available = true;
    }

    @Override
    public List<LedgerEntry> findEntries(String reference) {
        requireAvailable();
        return List.copyOf(entries.getOrDefault(reference, List.of()));
    }

    @Override
    public LedgerProbe probe() {
        requireAvailable();
        return new LedgerProbe("mock-" + height.get(), height.get());
    }

    private void requireAvailable() {
        if (!available) {
            throw new LedgerUnavailableException("Mock ledger is offline");
        }
    }
}
