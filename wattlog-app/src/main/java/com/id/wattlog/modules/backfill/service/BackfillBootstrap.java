package com.id.wattlog.modules.backfill.service;

import com.id.wattlog.config.AppConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs the backfill once after start-up when {@code wattlog.backfill.enabled} is set.
 * Deployments fed by a real sensor leave it off.
 */
@Component
@Slf4j
public class BackfillBootstrap {

    private final AppConfig appConfig;
    private final BackfillGenerator backfillGenerator;

    public BackfillBootstrap(AppConfig appConfig, BackfillGenerator backfillGenerator) {
        this.appConfig = appConfig;
        this.backfillGenerator = backfillGenerator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!appConfig.isBackfillEnabled()) {
            log.debug("Synthetic backfill disabled");
            return;
        }
        try {
            backfillGenerator.run();
        } catch (Exception ex) {
            log.error("Error during startup backfill", ex);
        }
    }
}
