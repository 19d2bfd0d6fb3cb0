package com.namehub.ledger;

import org.bitcoinj.core.Base58;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.p2p.solanaj.rpc.RpcApi;
import org.p2p.solanaj.rpc.RpcClient;
import org.p2p.solanaj.rpc.RpcException;
import org.p2p.solanaj.rpc.types.ConfirmedTransaction;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SolanaLedgerClientTest {

    private static final String SIGNATURE = "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnb";
    private static final String PAYER = "PayerWallet1111111111111111111111111111111";
    private static final String TIP_ACCOUNT = "TipAccount11111111111111111111111111111111";
    private static final String TREASURY = "Treasury1111111111111111111111111111111111";
    private static final String MEMO_PROGRAM = "MemoSq4gqABAXKb96qnH8TysNcWxMyWCqXgDLGmfcHr";

    @Mock
    private RpcClient rpcClient;

    @Mock
    private RpcApi rpcApi;

    private SolanaLedgerClient ledgerClient;

    @BeforeEach
    void setUp() {
        when(rpcClient.getApi()).thenReturn(rpcApi);
        ledgerClient = new SolanaLedgerClient(rpcClient);
    }

    @Test
    void findEntries_reportsEverySystemTransferInInstructionOrder() throws Exception {
        ConfirmedTransaction.Instruction tip = instruction(3, List.of(0L, 1L),
                instructionData(SolanaLedgerClient.SYSTEM_TRANSFER_TAG, 5_000L));
        ConfirmedTransaction.Instruction payment = instruction(3, List.of(0L, 2L),
                instructionData(SolanaLedgerClient.SYSTEM_TRANSFER_TAG, 1_000_000L));
        ConfirmedTransaction confirmed = confirmed(
                List.of(PAYER, TIP_ACCOUNT, TREASURY, SolanaLedgerClient.SYSTEM_PROGRAM_ID),
                List.of(tip, payment)
        );
        when(rpcApi.getTransaction(SIGNATURE)).thenReturn(confirmed);

        List<LedgerClient.LedgerEntry> entries = ledgerClient.findEntries(SIGNATURE);

        assertEquals(2, entries.size());
        LedgerClient.LedgerEntry first = entries.get(0);
        assertEquals(LedgerOperation.TRANSFER, first.operation());
        assertEquals(PAYER, first.sender());
        assertEquals(TIP_ACCOUNT, first.recipient());
        assertEquals(5_000L, first.amount());

        LedgerClient.LedgerEntry second = entries.get(1);
        assertEquals(SIGNATURE, second.reference());
        assertEquals(LedgerOperation.TRANSFER, second.operation());
        assertEquals(PAYER, second.sender());
        assertEquals(TREASURY, second.recipient());
        assertEquals(1_000_000L, second.amount());
        assertEquals(321L, second.height());
    }

    @Test
    void findEntries_mapsNonSystemTransactionToOther() throws Exception {
        ConfirmedTransaction.Instruction memo = mock(ConfirmedTransaction.Instruction.class);
        when(memo.getProgramIdIndex()).thenReturn(1L);
        ConfirmedTransaction confirmed = confirmed(List.of(PAYER, MEMO_PROGRAM), List.of(memo));
        when(rpcApi.getTransaction(SIGNATURE)).thenReturn(confirmed);

        List<LedgerClient.LedgerEntry> entries = ledgerClient.findEntries(SIGNATURE);

        assertEquals(1, entries.size());
        LedgerClient.LedgerEntry entry = entries.get(0);
        assertEquals(LedgerOperation.OTHER, entry.operation());
        assertEquals(PAYER, entry.sender());
        assertNull(entry.recipient());
        assertEquals(0L, entry.amount());
        assertEquals(321L, entry.height());
    }

    @Test
    void findEntries_isEmptyForFailedTransaction() throws Exception {
        ConfirmedTransaction confirmed = mock(ConfirmedTransaction.class);
        ConfirmedTransaction.Meta meta = mock(ConfirmedTransaction.Meta.class);
        when(confirmed.getTransaction()).thenReturn(mock(ConfirmedTransaction.Transaction.class));
        when(confirmed.getMeta()).thenReturn(meta);
        when(meta.getErr()).thenReturn("InstructionError");
        when(rpcApi.getTransaction(SIGNATURE)).thenReturn(confirmed);

        assertTrue(ledgerClient.findEntries(SIGNATURE).isEmpty());
    }

    @Test
    void findEntries_isEmptyForUnknownSignature() throws Exception {
        when(rpcApi.getTransaction(SIGNATURE)).thenReturn(null);

        assertTrue(ledgerClient.findEntries(SIGNATURE).isEmpty());
    }

    @Test
    void findEntries_wrapsRpcFailureAsLedgerUnavailable() throws Exception {
        RpcException failure = new RpcException("connection reset");
        when(rpcApi.getTransaction(SIGNATURE)).thenThrow(failure);

        LedgerUnavailableException ex = assertThrows(LedgerUnavailableException.class,
                () -> ledgerClient.findEntries(SIGNATURE));

        assertSame(failure, ex.getCause());
    }

    @Test
    void decodeTransferLamports_readsSystemTransferInstruction() {
        String data = instructionData(SolanaLedgerClient.SYSTEM_TRANSFER_TAG, 1_500_000_000L);

        assertEquals(Optional.of(1_500_000_000L), SolanaLedgerClient.decodeTransferLamports(data));
    }

    @Test
    void decodeTransferLamports_ignoresOtherSystemInstructions() {
        // tag 0 is CreateAccount
        String data = instructionData(0, 42L);

        assertTrue(SolanaLedgerClient.decodeTransferLamports(data).isEmpty());
    }

    @Test
    void decodeTransferLamports_rejectsWrongLength() {
        byte[] shortData = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(SolanaLedgerClient.SYSTEM_TRANSFER_TAG)
                .putInt(7)
                .array();

        assertTrue(SolanaLedgerClient.decodeTransferLamports(Base58.encode(shortData)).isEmpty());
    }

    @Test
    void decodeTransferLamports_rejectsInvalidEncoding() {
        assertTrue(SolanaLedgerClient.decodeTransferLamports("0OIl").isEmpty());
        assertTrue(SolanaLedgerClient.decodeTransferLamports("").isEmpty());
        assertTrue(SolanaLedgerClient.decodeTransferLamports(null).isEmpty());
    }

    private static ConfirmedTransaction confirmed(
            List<String> accountKeys,
            List<ConfirmedTransaction.Instruction> instructions
    ) {
        ConfirmedTransaction confirmed = mock(ConfirmedTransaction.class);
        ConfirmedTransaction.Transaction transaction = mock(ConfirmedTransaction.Transaction.class);
        ConfirmedTransaction.Message message = mock(ConfirmedTransaction.Message.class);
        when(confirmed.getTransaction()).thenReturn(transaction);
        when(confirmed.getMeta()).thenReturn(mock(ConfirmedTransaction.Meta.class));
        when(confirmed.getSlot()).thenReturn(321L);
        when(transaction.getMessage()).thenReturn(message);
        when(message.getAccountKeys()).thenReturn(accountKeys);
        when(message.getInstructions()).thenReturn(instructions);
        return confirmed;
    }

    private static ConfirmedTransaction.Instruction instruction(long programIdIndex, List<Long> accounts, String data) {
        ConfirmedTransaction.Instruction instruction = mock(ConfirmedTransaction.Instruction.class);
        when(instruction.getProgramIdIndex()).thenReturn(programIdIndex);
        when(instruction.getAccounts()).thenReturn(accounts);
        when(instruction.getData()).thenReturn(data);
        return instruction;
    }

    private static String instructionData(int tag, long lamports) {
        byte[] bytes = ByteBuffer.allocate(12).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(tag)
                .putLong(lamports)
                .array();
        return Base58.encode(bytes);
    }
}
