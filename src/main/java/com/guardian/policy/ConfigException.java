package com.guardian.policy;

import com.guardian.contract.GuardianException;

/**
 * Malformed policy configuration. Raised while the rule set is assembled, so
 * the application fails at startup instead of evaluating a broken policy.
 */
public class ConfigException extends GuardianException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
