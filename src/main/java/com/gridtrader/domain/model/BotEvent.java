package com.gridtrader.domain.model;

import com.gridtrader.domain.enums.BotEventType;
import com.gridtrader.domain.enums.EventSeverity;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** An entry of the persisted event log (setups, recenters, kill switch, exposure breaches). */
@Data
@Builder
public class BotEvent {

    private Long id;
    private BotEventType eventType;
    private EventSeverity severity;
    private String message;
    private Map<String, Object> details;
    private LocalDateTime createdAt;
}
