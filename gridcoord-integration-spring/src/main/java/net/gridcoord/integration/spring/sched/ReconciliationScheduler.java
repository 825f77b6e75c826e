package net.gridcoord.integration.spring.sched;

import net.gridcoord.core.maintenance.ReconciliationLoop;
import net.gridcoord.core.maintenance.ReconciliationLoop.ReconciliationReport;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class ReconciliationScheduler {
    private final ReconciliationLoop loop;

    private Duration finishedRetention = Duration.ofDays(1);

    public ReconciliationScheduler(ReconciliationLoop loop) {
        this.loop = loop;
    }

    @Scheduled(fixedDelayString = "${gridcoord.reconciliation.interval-ms:5000}")
    public ReconciliationReport sweep() throws Exception {
        return loop.runOnce(finishedRetention);
    }

    public void setFinishedRetention(Duration finishedRetention) {
        this.finishedRetention = finishedRetention;
    }
}
