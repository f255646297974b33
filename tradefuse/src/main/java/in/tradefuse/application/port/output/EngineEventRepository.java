package in.tradefuse.application.port.output;

import in.tradefuse.domain.common.EngineEvent;

/**
 * Durable engine event log.
 */
public interface EngineEventRepository {

    void append(EngineEvent event);
}
