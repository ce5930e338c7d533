package com.guardian.generation;

import com.guardian.contract.GuardianException;

/**
 * Every generation attempt failed for a reason other than a timeout.
 */
public class GenerationFailedException extends GuardianException {

    public GenerationFailedException(String message) {
        super(message);
    }

    public GenerationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
