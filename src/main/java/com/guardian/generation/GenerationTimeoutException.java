package com.guardian.generation;

import com.guardian.contract.GuardianException;

/**
 * The backend did not answer within the configured timeout on any attempt.
 * The gateway records this as a defer verdict, never a pass.
 */
public class GenerationTimeoutException extends GuardianException {

    public GenerationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
