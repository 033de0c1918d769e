package dao.fhe.settle.repository;

import dao.fhe.settle.model.Intent;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "local", matchIfMissing = true)
public class InMemoryIntentRepository implements IntentRepository {

    private final Map<String, Intent> intentsById = new ConcurrentHashMap<>();

    @Override
    public void save(Intent intent) {
        if (intentsById.putIfAbsent(intent.getId(), intent) != null) {
            throw new IllegalArgumentException("Duplicate intent id: " + intent.getId());
        }
    }

    @Override
    public Optional<Intent> findById(String intentId) {
        return Optional.ofNullable(intentsById.get(intentId));
    }

    @Override
    public long count() {
        return intentsById.size();
    }
}
