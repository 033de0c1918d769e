package dao.fhe.settle.repository;

import dao.fhe.settle.model.Batch;
import dao.fhe.settle.model.BatchState;

import java.util.List;
import java.util.Optional;

public interface BatchRepository {

    void save(Batch batch);

    List<Batch> findAll();

    Optional<Batch> findById(String batchId);

    Optional<Batch> findOpenByPool(String poolId);

    List<Batch> findByState(BatchState state);
}
