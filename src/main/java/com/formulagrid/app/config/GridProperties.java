package com.formulagrid.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "grid." prefix.
 */
@ConfigurationProperties(prefix = "grid")
public class GridProperties {

    /**
     * Fill a small sample sheet (A1=5, B1==A1+3, C1==B1*2) on startup.
     */
    private boolean seedSample = false;

    public boolean isSeedSample() {
        return seedSample;
    }

    public void setSeedSample(boolean seedSample) {
        this.seedSample = seedSample;
    }
}
