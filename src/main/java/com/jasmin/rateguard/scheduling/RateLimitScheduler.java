package com.jasmin.rateguard.scheduling;

import com.jasmin.rateguard.config.RateLimitProperties;
import com.jasmin.rateguard.services.BlockListService;
import com.jasmin.rateguard.services.RuleStore;
import com.jasmin.rateguard.store.CounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledFuture;

/**
 * Runs the rule refresh and the expired block sweep on their own fixed delays.
 * A failing iteration is logged and the next one still runs.
 */
@Slf4j
@Component
public class RateLimitScheduler implements SmartLifecycle {

    private final RuleStore ruleStore;
    private final BlockListService blockList;
    private final CounterStore store;
    private final RateLimitProperties props;

    private ThreadPoolTaskScheduler scheduler;
    private ScheduledFuture<?> refreshTask;
    private ScheduledFuture<?> sweepTask;
    private volatile boolean running;

    public RateLimitScheduler(RuleStore ruleStore, BlockListService blockList, CounterStore store,
                              RateLimitProperties props) {
        this.ruleStore = ruleStore;
        this.blockList = blockList;
        this.store = store;
        this.props = props;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        safely("rule seeding", ruleStore::seedIfEmpty);
        safely("rule refresh", ruleStore::refreshRules);

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("rate-limit-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        refreshTask = scheduler.scheduleWithFixedDelay(
                () -> safely("rule refresh", ruleStore::refreshRules),
                scheduler.getClock().instant().plus(props.getRuleRefreshInterval()),
                props.getRuleRefreshInterval());
        sweepTask = scheduler.scheduleWithFixedDelay(
                this::sweep,
                scheduler.getClock().instant().plus(props.getBlockSweepInterval()),
                props.getBlockSweepInterval());

        running = true;
        log.info("Rate limit maintenance started (refresh every {}, sweep every {})",
                props.getRuleRefreshInterval(), props.getBlockSweepInterval());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        cancel(refreshTask);
        cancel(sweepTask);
        refreshTask = null;
        sweepTask = null;
        scheduler.shutdown();
        scheduler = null;
        running = false;
        log.info("Rate limit maintenance stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void sweep() {
        safely("expired block sweep", blockList::sweepExpired);
        safely("counter eviction", store::evictExpired);
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static void safely(String name, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Rate limit {} failed", name, e);
        }
    }
}
