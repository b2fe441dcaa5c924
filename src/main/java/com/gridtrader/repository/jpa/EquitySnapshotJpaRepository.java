package com.gridtrader.repository.jpa;

import com.gridtrader.entity.EquitySnapshotEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the equity_snapshots table. Results are oldest first, for charting. */
@Repository
public interface EquitySnapshotJpaRepository extends JpaRepository<EquitySnapshotEntity, Long> {

    List<EquitySnapshotEntity> findBySnapshotAtGreaterThanEqualOrderBySnapshotAtAsc(LocalDateTime since);
}
