package com.gridtrader.repository.jpa;

import com.gridtrader.entity.BotEventEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the bot_events table. */
@Repository
public interface BotEventJpaRepository extends JpaRepository<BotEventEntity, Long> {

    List<BotEventEntity> findByCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
            LocalDateTime since, Pageable pageable);
}
