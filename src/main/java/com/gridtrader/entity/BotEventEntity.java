package com.gridtrader.entity;

import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the bot_events table.
 * details holds a JSON object serialized by JsonHelper.
 */
@Entity
@Table(name = "bot_events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BotEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", columnDefinition = "varchar(40)", nullable = false)
    private BotEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private EventSeverity severity;

    @Column(length = 1000, nullable = false)
    private String message;

    @Column(length = 4000)
    private String details;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
