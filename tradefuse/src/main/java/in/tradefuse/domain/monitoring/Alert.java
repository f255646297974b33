package in.tradefuse.domain.monitoring;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator-facing alert with enough context (instrument, observed values, thresholds)
 * to diagnose without reading logs.
 *
 * Details keep insertion order so notifications list values the way the caller added them.
 */
public final class Alert {
    private final String alertType;
    private final AlertLevel level;
    private final String instrument;
    private final String message;
    private final Instant timestamp;
    private final Map<String, Object> details;

    private Alert(Builder builder) {
        this.alertType = builder.alertType;
        this.level = builder.level;
        this.instrument = builder.instrument;
        this.message = builder.message;
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    public String getAlertType() {
        return alertType;
    }

    public AlertLevel getLevel() {
        return level;
    }

    /**
     * Instrument the alert concerns, or null for engine-wide alerts.
     */
    public String getInstrument() {
        return instrument;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * Short headline for notification channels, e.g. "HIGH CIRCUIT_BREAKER_TRIPPED".
     */
    public String title() {
        return level + " " + alertType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String alertType;
        private AlertLevel level;
        private String instrument;
        private String message;
        private Instant timestamp;
        private final Map<String, Object> details = new LinkedHashMap<>();

        public Builder alertType(String alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder instrument(String instrument) {
            this.instrument = instrument;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder detail(String key, Object value) {
            if (key != null && value != null) {
                this.details.put(key, value);
            }
            return this;
        }

        public Builder details(Map<String, Object> details) {
            if (details != null) {
                details.forEach(this::detail);
            }
            return this;
        }

        public Alert build() {
            if (alertType == null || alertType.isBlank() || level == null || message == null) {
                throw new IllegalStateException("alertType, level and message are required");
            }
            return new Alert(this);
        }
    }

    @Override
    public String toString() {
        return String.format("[%s] %s %s: %s (%s)",
            level, alertType, instrument == null ? "-" : instrument, message, timestamp);
    }
}
