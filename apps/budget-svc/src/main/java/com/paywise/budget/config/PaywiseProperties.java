package com.paywise.budget.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "paywise")
public record PaywiseProperties(
        Analysis analysis,
        Db db
) {

    @ConstructorBinding
    public PaywiseProperties {
        // both sections are optional; accessors fall back to defaults
    }

    public Analysis analysis() {
        return analysis != null ? analysis : new Analysis(null, null, null);
    }

    public Db db() {
        return db != null ? db : new Db(null);
    }

    public record Analysis(Integer defaultPeriods, Integer maxPeriods, String zone) {
        public Analysis {
            if (defaultPeriods == null) {
                defaultPeriods = 6;
            }
            if (maxPeriods == null) {
                maxPeriods = 52;
            }
            if (zone == null || zone.isBlank()) {
                zone = "UTC";
            }
            if (defaultPeriods <= 0) {
                throw new IllegalArgumentException("defaultPeriods must be positive");
            }
            if (maxPeriods < defaultPeriods) {
                throw new IllegalArgumentException("maxPeriods must be at least defaultPeriods");
            }
            try {
                ZoneId.of(zone);
            } catch (DateTimeException ex) {
                throw new IllegalArgumentException("zone must be a valid time-zone id: " + zone, ex);
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    public record Db(Boolean bootstrapEnabled) {
        public boolean bootstrapEnabledFlag() {
            return bootstrapEnabled != null && bootstrapEnabled;
        }
    }
}
