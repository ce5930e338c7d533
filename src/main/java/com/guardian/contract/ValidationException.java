package com.guardian.contract;

/**
 * Thrown when a request is malformed. Always raised before anything is
 * written to the ledger.
 */
public class ValidationException extends GuardianException {

    public ValidationException(String message) {
        super(message);
    }
}
