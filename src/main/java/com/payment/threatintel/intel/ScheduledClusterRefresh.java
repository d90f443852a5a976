package com.payment.threatintel.intel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly forced rebuild so clusters age out (lifecycle) even when few reports arrive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "threat-intel.clustering.nightly-enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledClusterRefresh {

    private final RebuildCoordinator rebuildCoordinator;

    @Scheduled(cron = "${threat-intel.clustering.nightly-cron:0 30 2 * * *}")
    public void refresh() {
        RebuildSummary summary = rebuildCoordinator.forceRebuild();
        log.info("Nightly cluster refresh: status={}, clusters={}", summary.getStatus(), summary.getClusterCount());
    }
}
