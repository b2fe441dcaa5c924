package com.gridtrader.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SafetyStatus {

    private boolean safeToTrade;
    private boolean killSwitchActive;
    private String killSwitchReason;
    private boolean exposureOk;
    private LocalDateTime lastCheck;
}
