package io.hhplus.checkout.infrastructure.persistence.stock;

import io.hhplus.checkout.domain.stock.StockLedgerEntry;
import io.hhplus.checkout.domain.stock.StockLedgerRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 재고 원장 JPA Repository
 *
 * 재고 변경은 모두 단일 UPDATE 문으로 조건 검사와 변경을 함께 수행한다 (read-then-write 없음).
 * 호출자 트랜잭션이 있으면 참여하고, 없으면 문장 단위로 커밋된다.
 */
@Repository
@Primary
public interface JpaStockLedgerRepository extends JpaRepository<StockLedgerEntry, Long>, StockLedgerRepository {

    // Explicitly declare methods to resolve ambiguity with StockLedgerRepository
    @Override
    StockLedgerEntry save(StockLedgerEntry entry);

    @Override
    List<StockLedgerEntry> findAll();

    @Override
    Optional<StockLedgerEntry> findByProductIdAndSize(String productId, String size);

    @Override
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE StockLedgerEntry s SET s.reserved = s.reserved + :quantity " +
           "WHERE s.productId = :productId AND s.size = :size " +
           "AND s.stock - s.reserved >= :quantity")
    int reserve(@Param("productId") String productId, @Param("size") String size, @Param("quantity") int quantity);

    @Override
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE StockLedgerEntry s SET s.stock = s.stock - :quantity, s.reserved = s.reserved - :quantity " +
           "WHERE s.productId = :productId AND s.size = :size " +
           "AND s.reserved >= :quantity AND s.stock >= :quantity")
    int commit(@Param("productId") String productId, @Param("size") String size, @Param("quantity") int quantity);

    @Override
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE StockLedgerEntry s " +
           "SET s.reserved = CASE WHEN s.reserved >= :quantity THEN s.reserved - :quantity ELSE 0 END " +
           "WHERE s.productId = :productId AND s.size = :size AND s.reserved > 0")
    int release(@Param("productId") String productId, @Param("size") String size, @Param("quantity") int quantity);

    @Override
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE StockLedgerEntry s SET s.stock = s.stock + :quantity " +
           "WHERE s.productId = :productId AND s.size = :size")
    int addStock(@Param("productId") String productId, @Param("size") String size, @Param("quantity") int quantity);
}
