package com.guardian.ledger;

import com.guardian.contract.GuardianException;

/**
 * The ledger can no longer vouch for its own chain: a supplied previous hash
 * did not match the head, a stored record failed re-verification, or a record
 * could not be made durable. Fatal; the ledger refuses all further writes.
 */
public class IntegrityException extends GuardianException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
