package com.guardian.ledger;

import java.util.List;

/**
 * Append-only, hash-chained store of gate decisions. There is no update and
 * no delete.
 */
public interface DecisionLedger {

    /**
     * Appends an entry whose caller-observed head is {@code previousHash}.
     *
     * @throws IntegrityException if {@code previousHash} is not the current
     *         head hash; the ledger halts and refuses further writes
     */
    LedgerAppendResult append(DecisionEntry entry, String previousHash);

    /**
     * Appends an entry linked to whatever the head is when the single append
     * point is reached.
     */
    LedgerAppendResult record(DecisionEntry entry);

    /** Records with {@code fromInclusive <= sequence <= toInclusive}, ascending. */
    List<DecisionRecord> read(long fromInclusive, long toInclusive);

    /** Hash of the last record, or {@link RecordCodec#GENESIS_HASH} when empty. */
    String headHash();

    long size();

    boolean isHalted();
}
