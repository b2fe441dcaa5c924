package com.gridtrader.repository.jpa;

import com.gridtrader.entity.BotConfigEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** JPA repository for the bot_config table. At most one row has is_active = true. */
@Repository
public interface BotConfigJpaRepository extends JpaRepository<BotConfigEntity, Long> {

    Optional<BotConfigEntity> findFirstByActiveTrueOrderByCreatedAtDescIdDesc();

    @Modifying
    @Query("UPDATE BotConfigEntity c SET c.active = false WHERE c.active = true")
    int deactivateAll();
}
