package com.gridtrader.repository.jpa;

import com.gridtrader.domain.enums.OrderStatus;
import com.gridtrader.entity.GridOrderEntity;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the grid_orders table.
 */
@Repository
public interface GridOrderJpaRepository extends JpaRepository<GridOrderEntity, Long> {

    Optional<GridOrderEntity> findByOrderId(String orderId);

    boolean existsByOrderId(String orderId);

    @Modifying
    @Query("UPDATE GridOrderEntity o SET o.status = :status, o.filledAt = COALESCE(:filledAt, o.filledAt) "
            + "WHERE o.orderId = :orderId")
    int updateStatus(
            @Param("orderId") String orderId,
            @Param("status") OrderStatus status,
            @Param("filledAt") LocalDateTime filledAt);
}
