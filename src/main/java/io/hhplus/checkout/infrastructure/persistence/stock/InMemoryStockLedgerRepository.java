package io.hhplus.checkout.infrastructure.persistence.stock;

import io.hhplus.checkout.domain.stock.StockLedgerEntry;
import io.hhplus.checkout.domain.stock.StockLedgerRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * InMemory 재고 원장
 *
 * 조건 검사와 변경을 키 단위 compute 안에서 수행해 JPA 조건부 UPDATE와 같은 원자성을 갖는다.
 */
@Repository
@Profile("inmemory")
public class InMemoryStockLedgerRepository implements StockLedgerRepository {

    private final Map<String, StockLedgerEntry> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Optional<StockLedgerEntry> findByProductIdAndSize(String productId, String size) {
        return Optional.ofNullable(storage.get(key(productId, size)));
    }

    @Override
    public List<StockLedgerEntry> findAll() {
        return new ArrayList<>(storage.values());
    }

    @Override
    public StockLedgerEntry save(StockLedgerEntry entry) {
        if (entry.getId() == null) {
            StockLedgerEntry existing = storage.putIfAbsent(key(entry.getProductId(), entry.getSize()), entry);
            if (existing != null && existing != entry) {
                throw new DataIntegrityViolationException(
                    "Duplicate stock ledger entry: " + key(entry.getProductId(), entry.getSize()));
            }
            assignId(entry);
            return entry;
        }
        storage.put(key(entry.getProductId(), entry.getSize()), entry);
        return entry;
    }

    @Override
    public int reserve(String productId, String size, int quantity) {
        return apply(productId, size, entry -> {
            if (!entry.canReserve(quantity)) {
                return false;
            }
            entry.reserve(quantity);
            return true;
        });
    }

    @Override
    public int commit(String productId, String size, int quantity) {
        return apply(productId, size, entry -> {
            if (!entry.canCommit(quantity)) {
                return false;
            }
            entry.commit(quantity);
            return true;
        });
    }

    @Override
    public int release(String productId, String size, int quantity) {
        return apply(productId, size, entry -> entry.release(quantity));
    }

    @Override
    public int addStock(String productId, String size, int quantity) {
        return apply(productId, size, entry -> {
            entry.restock(quantity);
            return true;
        });
    }

    private int apply(String productId, String size, Predicate<StockLedgerEntry> mutation) {
        int[] updated = {0};
        storage.computeIfPresent(key(productId, size), (k, entry) -> {
            if (mutation.test(entry)) {
                updated[0] = 1;
            }
            return entry;
        });
        return updated[0];
    }

    private void assignId(StockLedgerEntry entry) {
        try {
            var idField = StockLedgerEntry.class.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(entry, idGenerator.getAndIncrement());
        } catch (Exception e) {
            throw new RuntimeException("Failed to set ID", e);
        }
    }

    private static String key(String productId, String size) {
        return productId + "::" + size;
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
