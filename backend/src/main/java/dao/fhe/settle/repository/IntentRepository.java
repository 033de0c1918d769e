package dao.fhe.settle.repository;

import dao.fhe.settle.model.Intent;

import java.util.Optional;

public interface IntentRepository {

    void save(Intent intent);

    Optional<Intent> findById(String intentId);

    long count();
}
