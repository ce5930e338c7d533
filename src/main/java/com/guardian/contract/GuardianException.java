package com.guardian.contract;

/**
 * Root of the Guardian failure taxonomy. All subclasses are unchecked so that
 * the engine and the ledger never have to swallow a failure to satisfy a
 * signature.
 */
public class GuardianException extends RuntimeException {

    public GuardianException(String message) {
        super(message);
    }

    public GuardianException(String message, Throwable cause) {
        super(message, cause);
    }
}
