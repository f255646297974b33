package in.tradefuse.support;

import in.tradefuse.application.port.output.OrderPublisher;
import in.tradefuse.domain.order.OrderRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RecordingOrderPublisher implements OrderPublisher {

    private final Map<String, OrderRequest> published = new LinkedHashMap<>();
    private int remainingFailures;

    @Override
    public void publish(OrderRequest request) {
        if (remainingFailures > 0) {
            remainingFailures--;
            throw new RuntimeException("queue unavailable");
        }
        published.putIfAbsent(request.requestId(), request);
    }

    public List<OrderRequest> published() {
        return new ArrayList<>(published.values());
    }

    public void failNext(int times) {
        this.remainingFailures = times;
    }
}
