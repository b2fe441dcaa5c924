package com.gridtrader.repository.jpa;

import com.gridtrader.entity.GridHistoryEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the grid_history table. */
@Repository
public interface GridHistoryJpaRepository extends JpaRepository<GridHistoryEntity, Long> {

    Optional<GridHistoryEntity> findFirstByOrderByCreatedAtDescIdDesc();
}
