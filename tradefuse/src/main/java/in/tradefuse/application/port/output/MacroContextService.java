package in.tradefuse.application.port.output;

import in.tradefuse.domain.signal.MacroResult;

/**
 * Market-wide macro context collaborator. Freshness is judged by the caller.
 */
public interface MacroContextService {

    MacroResult latest();
}
