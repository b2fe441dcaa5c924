package com.gridtrader.risk;

import java.time.LocalDateTime;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one {@link KillSwitchService#activate} call.
 *
 * <p>{@code activated} is false only for a duplicate call against an already latched switch.
 * Cancellation is best-effort: a latched result may still report {@code ordersCancelled=false}
 * with the failure in {@code errors}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class KillSwitchResult {

    boolean activated;
    boolean ordersCancelled;
    String reason;
    List<String> errors;
    LocalDateTime activatedAt;

    static KillSwitchResult latched(
            String reason, LocalDateTime activatedAt, boolean ordersCancelled, List<String> errors) {
        return new KillSwitchResult(true, ordersCancelled, reason, List.copyOf(errors), activatedAt);
    }

    static KillSwitchResult alreadyActive(String reason, LocalDateTime activatedAt) {
        return new KillSwitchResult(false, false, reason, List.of(), activatedAt);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
