package com.namehub.ledger;

public enum LedgerOperation {
    TRANSFER,
    MINT,
    BURN,
    OTHER
}
