package in.tradefuse.domain.common;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only engine event. instrument is null for portfolio-wide events.
 */
public record EngineEvent(
    EngineEventType type,
    String instrument,
    Instant timestamp,
    Map<String, Object> payload
) {
    public EngineEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
