package com.dealtracker.bot.scheduler;

import com.dealtracker.bot.exception.DispatchException;
import com.dealtracker.bot.model.AlertMessage;
import com.dealtracker.bot.model.CategoryTarget;
import com.dealtracker.bot.model.ClassifiedListing;
import com.dealtracker.bot.model.ListingCandidate;
import com.dealtracker.bot.model.PassSummary;
import com.dealtracker.bot.model.RunConfig;
import com.dealtracker.bot.output.MessageSink;
import com.dealtracker.bot.service.CategoryPipeline;
import com.dealtracker.bot.test.fixtures.MutableClock;
import com.dealtracker.bot.test.fixtures.RunConfigFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DealSchedulerTest {

    private static final CategoryTarget MOBILES = new CategoryTarget("mobiles", "https://shop.test/mobiles");
    private static final CategoryTarget WATCHES = new CategoryTarget("watches", "https://shop.test/watches");

    @Mock
    private CategoryPipeline categoryPipeline;

    @Mock
    private MessageSink messageSink;

    private final RunConfig config = RunConfigFixtures.runConfig();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-05T09:00:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();

    private DealScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new DealScheduler(categoryPipeline, messageSink, config, clock, sleeps::add, true);
    }

    private static AlertMessage message(String category, String title) {
        ClassifiedListing listing = ClassifiedListing.builder()
                .candidate(ListingCandidate.builder()
                        .title(title)
                        .link("https://www.amazon.in/dp/" + title)
                        .price(new BigDecimal("500"))
                        .build())
                .qualifies(true)
                .build();
        return new AlertMessage("alert: " + title, category, listing);
    }

    @Test
    void runPass_visitsCategoriesInOrder_andDeliversEveryMessage() throws Exception {
        when(categoryPipeline.run(MOBILES, config)).thenReturn(List.of(message("mobiles", "a"), message("mobiles", "b")));
        when(categoryPipeline.run(WATCHES, config)).thenReturn(List.of(message("watches", "c")));

        PassSummary summary = scheduler.runPass("scheduled");

        InOrder order = inOrder(categoryPipeline, messageSink);
        order.verify(categoryPipeline).run(MOBILES, config);
        order.verify(messageSink).deliver(RunConfigFixtures.RECIPIENT, "alert: a");
        order.verify(messageSink).deliver(RunConfigFixtures.RECIPIENT, "alert: b");
        order.verify(categoryPipeline).run(WATCHES, config);
        order.verify(messageSink).deliver(RunConfigFixtures.RECIPIENT, "alert: c");

        assertThat(summary.categoriesVisited()).isEqualTo(2);
        assertThat(summary.alertsComposed()).isEqualTo(3);
        assertThat(summary.alertsSent()).isEqualTo(3);
        assertThat(scheduler.getLastPass()).contains(summary);
    }

    @Test
    void runPass_failingCategory_doesNotStopLaterCategories() throws Exception {
        when(categoryPipeline.run(MOBILES, config)).thenThrow(new IllegalStateException("transport blew up"));
        when(categoryPipeline.run(WATCHES, config)).thenReturn(List.of(message("watches", "c")));

        PassSummary summary = scheduler.runPass("scheduled");

        verify(messageSink).deliver(RunConfigFixtures.RECIPIENT, "alert: c");
        assertThat(summary.categoriesFailed()).isEqualTo(1);
        assertThat(summary.alertsSent()).isEqualTo(1);
    }

    @Test
    void runPass_pacesOnlyAfterSuccessfulDeliveries() throws Exception {
        when(categoryPipeline.run(MOBILES, config)).thenReturn(
                List.of(message("mobiles", "a"), message("mobiles", "b"), message("mobiles", "c")));
        when(categoryPipeline.run(WATCHES, config)).thenReturn(List.of());
        lenient().doThrow(new DispatchException("Too Many Requests"))
                .when(messageSink).deliver(RunConfigFixtures.RECIPIENT, "alert: b");

        PassSummary summary = scheduler.runPass("scheduled");

        verify(messageSink).deliver(RunConfigFixtures.RECIPIENT, "alert: c");
        assertThat(sleeps).containsExactly(config.getDispatchPacing(), config.getDispatchPacing());
        assertThat(summary.alertsSent()).isEqualTo(2);
        assertThat(summary.alertsFailed()).isEqualTo(1);
    }

    @Test
    void tick_runsPassOnlyOnceIntervalHasElapsed() throws Exception {
        when(categoryPipeline.run(any(), eq(config))).thenReturn(List.of());
        scheduler.runPass("startup");

        clock.advance(Duration.ofMinutes(2).plusSeconds(58));
        assertThat(scheduler.tick()).isFalse();

        clock.advance(Duration.ofSeconds(2));
        assertThat(scheduler.tick()).isTrue();

        assertThat(scheduler.tick()).isFalse();
        verify(categoryPipeline, times(2)).run(MOBILES, config);
    }

    @Test
    void tick_withoutRunningLoop_ignoresPassRequests() throws Exception {
        when(categoryPipeline.run(any(), eq(config))).thenReturn(List.of());
        scheduler.runPass("startup");

        assertThat(scheduler.requestPass()).isFalse();
        assertThat(scheduler.tick()).isFalse();
    }

    @Test
    void runLoop_startupNoticeFailure_stillRunsFirstPass_andStopsWhenCancelled() throws Exception {
        when(categoryPipeline.run(any(), eq(config))).thenReturn(List.of());
        doThrow(new DispatchException("Unauthorized"))
                .when(messageSink).deliver(RunConfigFixtures.RECIPIENT, DealScheduler.STARTUP_NOTICE);

        List<Duration> loopSleeps = new ArrayList<>();
        DealScheduler[] self = new DealScheduler[1];
        self[0] = new DealScheduler(categoryPipeline, messageSink, config, clock, duration -> {
            loopSleeps.add(duration);
            clock.advance(Duration.ofMinutes(1));
            if (loopSleeps.size() == 4) {
                self[0].stop();
            }
        }, true);

        self[0].runLoop();

        // startup pass at t0, then a scheduled pass on the tick after 3 minutes
        verify(categoryPipeline, times(2)).run(MOBILES, config);
        verify(categoryPipeline, times(2)).run(WATCHES, config);
        assertThat(loopSleeps).hasSize(4).containsOnly(config.getTick());
        assertThat(self[0].getLastPass()).isPresent();
    }

    @Test
    void runLoop_interruptedSleep_endsLoop() throws Exception {
        when(categoryPipeline.run(any(), eq(config))).thenReturn(List.of());
        DealScheduler interrupted = new DealScheduler(categoryPipeline, messageSink, config, clock, duration -> {
            throw new InterruptedException("shutdown");
        }, true);

        interrupted.runLoop();

        verify(messageSink).deliver(RunConfigFixtures.RECIPIENT, DealScheduler.STARTUP_NOTICE);
        verify(categoryPipeline, times(1)).run(MOBILES, config);
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void start_whenDisabled_doesNotRunAnything() throws Exception {
        DealScheduler disabled = new DealScheduler(categoryPipeline, messageSink, config, clock, sleeps::add, false);

        disabled.start();

        assertThat(disabled.isRunning()).isFalse();
        verify(messageSink, never()).deliver(anyString(), anyString());
    }
}
