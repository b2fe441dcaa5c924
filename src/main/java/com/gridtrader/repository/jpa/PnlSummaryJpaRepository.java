package com.gridtrader.repository.jpa;

import com.gridtrader.entity.PnlSummaryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the pnl_summary table. */
@Repository
public interface PnlSummaryJpaRepository extends JpaRepository<PnlSummaryEntity, Long> {}
