package com.guardian.ledger;

/** Position and seal of a freshly appended record. */
public record LedgerAppendResult(long sequence, String hash) {
}
