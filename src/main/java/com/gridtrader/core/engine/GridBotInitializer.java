package com.gridtrader.core.engine;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Initializes the bot once the context is up. An exception here fails application startup,
 * which is what a missing instrument spec should do.
 */
@Component
@ConditionalOnProperty(name = "gridbot.auto-initialize", havingValue = "true", matchIfMissing = true)
public class GridBotInitializer implements ApplicationRunner {

    private final GridBotSupervisor gridBotSupervisor;

    public GridBotInitializer(GridBotSupervisor gridBotSupervisor) {
        this.gridBotSupervisor = gridBotSupervisor;
    }

    @Override
    public void run(ApplicationArguments args) {
        gridBotSupervisor.initialize();
    }
}
