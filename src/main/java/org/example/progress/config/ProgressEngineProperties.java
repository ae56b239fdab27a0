package org.example.progress.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

@ConfigurationProperties(prefix = "progress")
public class ProgressEngineProperties {

    private String zoneId = "UTC";
    private BigDecimal defaultPlaybackSpeed = new BigDecimal("1.0");
    private BigDecimal minPlaybackSpeed = new BigDecimal("0.5");
    private BigDecimal maxPlaybackSpeed = new BigDecimal("3.0");
    private int lockStripes = 256;

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId == null || zoneId.isBlank() ? "UTC" : zoneId.trim();
    }

    public BigDecimal getDefaultPlaybackSpeed() {
        return defaultPlaybackSpeed;
    }

    public void setDefaultPlaybackSpeed(BigDecimal defaultPlaybackSpeed) {
        this.defaultPlaybackSpeed = defaultPlaybackSpeed;
    }

    public BigDecimal getMinPlaybackSpeed() {
        return minPlaybackSpeed;
    }

    public void setMinPlaybackSpeed(BigDecimal minPlaybackSpeed) {
        this.minPlaybackSpeed = minPlaybackSpeed;
    }

    public BigDecimal getMaxPlaybackSpeed() {
        return maxPlaybackSpeed;
    }

    public void setMaxPlaybackSpeed(BigDecimal maxPlaybackSpeed) {
        this.maxPlaybackSpeed = maxPlaybackSpeed;
    }

    public int getLockStripes() {
        return lockStripes;
    }

    public void setLockStripes(int lockStripes) {
        this.lockStripes = lockStripes;
    }

    public boolean isSupportedPlaybackSpeed(BigDecimal speed) {
        return speed != null
                && speed.compareTo(minPlaybackSpeed) >= 0
                && speed.compareTo(maxPlaybackSpeed) <= 0;
    }
}
