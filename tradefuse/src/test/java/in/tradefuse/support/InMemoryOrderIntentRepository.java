package in.tradefuse.support;

import in.tradefuse.application.port.output.OrderIntentRepository;
import in.tradefuse.domain.order.IntentStatus;
import in.tradefuse.domain.order.OrderIntent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryOrderIntentRepository implements OrderIntentRepository {

    private final Map<String, OrderIntent> intents = new LinkedHashMap<>();

    @Override
    public boolean claim(OrderIntent intent) {
        return intents.putIfAbsent(intent.intentKey(), intent) == null;
    }

    @Override
    public void markPlaced(String intentKey, String orderId) {
        intents.computeIfPresent(intentKey, (k, i) -> new OrderIntent(k, i.batchId(), i.requestId(), i.instrument(),
            i.action(), IntentStatus.PLACED, orderId, i.detail(), i.createdAt()));
    }

    @Override
    public void markFailed(String intentKey, String detail) {
        intents.computeIfPresent(intentKey, (k, i) -> new OrderIntent(k, i.batchId(), i.requestId(), i.instrument(),
            i.action(), IntentStatus.FAILED, i.orderId(), detail, i.createdAt()));
    }

    @Override
    public Optional<OrderIntent> find(String intentKey) {
        return Optional.ofNullable(intents.get(intentKey));
    }

    public int size() {
        return intents.size();
    }
}
