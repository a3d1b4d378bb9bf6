package com.dealtracker.bot.scheduler;

import com.dealtracker.bot.exception.DispatchException;
import com.dealtracker.bot.model.AlertMessage;
import com.dealtracker.bot.model.CategoryTarget;
import com.dealtracker.bot.model.PassSummary;
import com.dealtracker.bot.model.RunConfig;
import com.dealtracker.bot.output.MessageSink;
import com.dealtracker.bot.service.CategoryPipeline;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives passes over all configured categories.
 *
 * On startup: send the "bot started" notice, run one pass immediately, then poll every
 * tick and run another pass once the interval has elapsed since the previous one finished.
 *
 * Everything (fetches, deliveries, pacing) happens on the single "deal-scheduler" thread,
 * so categories are always visited in configured order and alerts go out in page order.
 * The loop runs until the application context is closed.
 */
@Component
@Slf4j
public class DealScheduler {

    static final String STARTUP_NOTICE = "🤖 Bot started. Monitoring categories…";

    private final CategoryPipeline categoryPipeline;
    private final MessageSink messageSink;
    private final RunConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final boolean enabled;

    private final AtomicBoolean passRequested = new AtomicBoolean(false);
    private volatile boolean cancelled;
    private volatile Thread loopThread;
    private volatile PassSummary lastPass;

    /** End of the previous pass; touched only by the loop thread */
    private Instant lastPassAt;

    @Autowired
    public DealScheduler(CategoryPipeline categoryPipeline, MessageSink messageSink, RunConfig config,
                         Clock clock) {
        this(categoryPipeline, messageSink, config, clock, Sleeper.threadSleep(), config.isSchedulingEnabled());
    }

    DealScheduler(CategoryPipeline categoryPipeline, MessageSink messageSink, RunConfig config,
                  Clock clock, Sleeper sleeper, boolean enabled) {
        this.categoryPipeline = categoryPipeline;
        this.messageSink = messageSink;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.enabled = enabled;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Polling loop disabled (deal-bot.scheduling.enabled=false)");
            return;
        }
        Thread thread = new Thread(this::runLoop, "deal-scheduler");
        loopThread = thread;
        thread.start();
    }

    @PreDestroy
    public void stop() {
        cancelled = true;
        Thread thread = loopThread;
        if (thread == null) return;

        thread.interrupt();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(10));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Polling loop shut down");
    }

    public boolean isRunning() {
        Thread thread = loopThread;
        return !cancelled && thread != null && thread.isAlive();
    }

    /**
     * Ask for an extra pass on the next tick. The pass still runs on the loop thread.
     *
     * @return false if the loop is not running
     */
    public boolean requestPass() {
        if (!isRunning()) return false;
        passRequested.set(true);
        return true;
    }

    public Optional<PassSummary> getLastPass() {
        return Optional.ofNullable(lastPass);
    }

    // ── Loop ─────────────────────────────────────────────────────────────────

    void runLoop() {
        log.info("Bot started: {} categories, checking every {} min",
                config.getCategories().size(), config.getPollIntervalMinutes());
        announceStartup();

        try {
            runPass("startup");
            while (!cancelled) {
                tick();
                sleeper.sleep(config.getTick());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Polling loop interrupted");
        }
    }

    /**
     * @return true if a pass ran on this tick
     */
    boolean tick() throws InterruptedException {
        boolean requested = passRequested.getAndSet(false);
        boolean due = lastPassAt == null
                || !clock.instant().isBefore(lastPassAt.plus(config.getPollInterval()));

        if (due) {
            runPass("scheduled");
        } else if (requested) {
            runPass("manual");
        } else {
            return false;
        }
        return true;
    }

    PassSummary runPass(String trigger) throws InterruptedException {
        Instant startedAt = clock.instant();
        List<CategoryTarget> categories = config.getCategories();
        log.info("Starting {} pass over {} categories", trigger, categories.size());

        int visited = 0;
        int failedCategories = 0;
        int composed = 0;
        int sent = 0;
        int failed = 0;

        for (CategoryTarget category : categories) {
            if (cancelled) break;
            visited++;

            List<AlertMessage> messages;
            try {
                messages = categoryPipeline.run(category, config);
            } catch (RuntimeException e) {
                failedCategories++;
                log.warn("Error checking {}: {}", category.name(), e.getMessage(), e);
                continue;
            }
            composed += messages.size();

            for (AlertMessage message : messages) {
                if (dispatch(message)) {
                    sent++;
                    sleeper.sleep(config.getDispatchPacing());
                } else {
                    failed++;
                }
            }
        }

        lastPassAt = clock.instant();
        PassSummary summary = new PassSummary(startedAt, lastPassAt, visited, failedCategories,
                composed, sent, failed);
        lastPass = summary;

        log.info("Sent {} alert(s). ({} composed, {} failed, {}/{} categories OK)",
                sent, composed, failed, visited - failedCategories, categories.size());
        return summary;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean dispatch(AlertMessage message) {
        try {
            messageSink.deliver(config.getRecipient(), message.text());
            return true;
        } catch (DispatchException | RuntimeException e) {
            log.warn("Telegram send failed ({} / {}): {}",
                    message.categoryName(), message.listing().getTitle(), e.getMessage());
            return false;
        }
    }

    private void announceStartup() {
        try {
            messageSink.deliver(config.getRecipient(), STARTUP_NOTICE);
        } catch (DispatchException | RuntimeException e) {
            log.error("Failed to send startup message: {}", e.getMessage());
        }
    }
}
