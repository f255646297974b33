package in.tradefuse.application.port.output;

import in.tradefuse.domain.signal.SentimentResult;

/**
 * News sentiment collaborator.
 */
public interface SentimentService {

    SentimentResult latest(String instrument);
}
