package com.gridtrader.repository.jpa;

import com.gridtrader.entity.TradeEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades table.
 * Supports fill deduplication by execId and the windowed queries behind P&L summaries.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, Long> {

    boolean existsByExecId(String execId);

    List<TradeEntity> findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(LocalDateTime since);

    long countByExecutedAtGreaterThanEqual(LocalDateTime since);
}
