package in.tradefuse.support;

import in.tradefuse.application.port.output.EngineEventRepository;
import in.tradefuse.domain.common.EngineEvent;
import in.tradefuse.domain.common.EngineEventType;

import java.util.ArrayList;
import java.util.List;

public class InMemoryEngineEventRepository implements EngineEventRepository {

    private final List<EngineEvent> events = new ArrayList<>();

    @Override
    public void append(EngineEvent event) {
        events.add(event);
    }

    public List<EngineEvent> all() {
        return List.copyOf(events);
    }

    public List<EngineEvent> ofType(EngineEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    /**
     * Alerts recorded under the given alert type.
     */
    public List<EngineEvent> alerts(String alertType) {
        return events.stream()
            .filter(e -> e.type() == EngineEventType.ALERT && alertType.equals(e.payload().get("alertType")))
            .toList();
    }
}
