package com.guardian.policy;

/**
 * Decision thresholds on aggregate risk. {@code defer <= halt}, both in [0,1].
 */
public record Thresholds(double defer, double halt) {

    public Thresholds {
        if (Double.isNaN(defer) || defer < 0.0 || defer > 1.0) {
            throw new ConfigException("defer threshold must be within [0,1]");
        }
        if (Double.isNaN(halt) || halt < 0.0 || halt > 1.0) {
            throw new ConfigException("halt threshold must be within [0,1]");
        }
        if (defer > halt) {
            throw new ConfigException("defer threshold must not exceed halt threshold");
        }
    }
}
