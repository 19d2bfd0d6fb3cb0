package com.namehub.ledger;

import org.bitcoinj.core.Base58;
import org.p2p.solanaj.rpc.RpcClient;
import org.p2p.solanaj.rpc.RpcException;
import org.p2p.solanaj.rpc.types.ConfirmedTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves payment references as Solana transaction signatures.
 * Only native SOL transfers through the System Program count as transfers; every such instruction
 * in the transaction is reported.
 */
@Component
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "solana")
public class SolanaLedgerClient implements LedgerClient {

    static final String SYSTEM_PROGRAM_ID = "11111111111111111111111111111111";
    static final int SYSTEM_TRANSFER_TAG = 2;

    private static final Logger log = LoggerFactory.getLogger(SolanaLedgerClient.class);

    private final RpcClient rpcClient;

    public SolanaLedgerClient(RpcClient rpcClient) {
        this.rpcClient = rpcClient;
    }

    @Override
    public List<LedgerEntry> findEntries(String reference) {
        ConfirmedTransaction transaction;
        try {
            transaction = rpcClient.getApi().getTransaction(reference);
        } catch (RpcException e) {
            throw new LedgerUnavailableException("Failed to fetch transaction " + reference, e);
        } catch (RuntimeException e) {
            throw new LedgerUnavailableException("Unreadable ledger response for " + reference, e);
        }

        if (transaction == null || transaction.getTransaction() == null || transaction.getMeta() == null) {
            log.debug("No confirmed transaction for reference {}", reference);
            return List.of();
        }
        if (transaction.getMeta().getErr() != null) {
            log.debug("Transaction {} failed on-chain: {}", reference, transaction.getMeta().getErr());
            return List.of();
        }

        ConfirmedTransaction.Message message = transaction.getTransaction().getMessage();
        List<String> accountKeys = message.getAccountKeys();
        List<LedgerEntry> transfers = new ArrayList<>();
        for (ConfirmedTransaction.Instruction instruction : message.getInstructions()) {
            String programId = accountKeys.get((int) instruction.getProgramIdIndex());
            if (!SYSTEM_PROGRAM_ID.equals(programId) || instruction.getAccounts().size() < 2) {
                continue;
            }
            Optional<Long> lamports = decodeTransferLamports(instruction.getData());
            if (lamports.isEmpty()) {
                continue;
            }
            String sender = accountKeys.get(instruction.getAccounts().get(0).intValue());
            String recipient = accountKeys.get(instruction.getAccounts().get(1).intValue());
            transfers.add(new LedgerEntry(
                    reference,
                    LedgerOperation.TRANSFER,
                    sender,
                    recipient,
                    lamports.get(),
                    transaction.getSlot(),
                    null
            ));
        }
        if (!transfers.isEmpty()) {
            return transfers;
        }

        String feePayer = accountKeys.isEmpty() ? null : accountKeys.get(0);
        return List.of(new LedgerEntry(
                reference,
                LedgerOperation.OTHER,
                feePayer,
                null,
                0L,
                transaction.getSlot(),
                null
        ));
    }

    @Override
    public LedgerProbe probe() {
        try {
            String blockhash = rpcClient.getApi().getLatestBlockhash().getValue().getBlockhash();
            long slot = rpcClient.getApi().getSlot();
            return new LedgerProbe(blockhash, slot);
        } catch (RpcException e) {
            throw new LedgerUnavailableException("Solana RPC probe failed", e);
        }
    }

    /**
     * System Program transfer data is a little-endian u32 tag of 2 followed by a u64 lamport amount.
     */
    static Optional<Long> decodeTransferLamports(String base58Data) {
        if (base58Data == null || base58Data.isEmpty()) {
            return Optional.empty();
        }
        byte[] data;
        try {
            data = Base58.decode(base58Data);
        } catch (RuntimeException e) {
            return Optional.empty();
        }
        if (data.length != 12) {
            return Optional.empty();
        }
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        if (buffer.getInt() != SYSTEM_TRANSFER_TAG) {
            return Optional.empty();
        }
        return Optional.of(buffer.getLong());
    }
}
