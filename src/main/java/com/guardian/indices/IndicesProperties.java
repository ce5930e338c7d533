package com.guardian.indices;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "guardian.indices")
public class IndicesProperties {

    /**
     * Protection index reported when no rule fired. Kept below 1.0 to leave
     * calibration headroom.
     */
    private double protectionBaseline = 0.99;

    /** Lowest protection index ever reported. */
    private double protectionFloor = 0.01;

    public double getProtectionBaseline() {
        return protectionBaseline;
    }

    public void setProtectionBaseline(double protectionBaseline) {
        this.protectionBaseline = protectionBaseline;
    }

    public double getProtectionFloor() {
        return protectionFloor;
    }

    public void setProtectionFloor(double protectionFloor) {
        this.protectionFloor = protectionFloor;
    }
}
