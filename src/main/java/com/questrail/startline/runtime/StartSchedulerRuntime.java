package com.questrail.startline.runtime;

import com.questrail.startline.api.StartScheduler;
import com.questrail.startline.codec.StartEventDatagramCodec;
import com.questrail.startline.config.BroadcastConfig;
import com.questrail.startline.config.SchedulerConfig;
import com.questrail.startline.core.RollingStartScheduler;
import com.questrail.startline.internal.exec.CountdownListener;
import com.questrail.startline.internal.exec.CountdownTicker;
import com.questrail.startline.internal.time.MonotonicClock;
import com.questrail.startline.internal.time.MonotonicScheduler;
import com.questrail.startline.internal.time.ScheduledExecutorScheduler;
import com.questrail.startline.internal.time.SystemMonotonicClock;
import com.questrail.startline.internal.time.SystemWallClock;
import com.questrail.startline.internal.time.WallClock;
import com.questrail.startline.observability.CompositeStartEventSink;
import com.questrail.startline.observability.Slf4jStartEventSink;
import com.questrail.startline.observability.StartEventSink;
import com.questrail.startline.persistence.InMemoryScheduleRepository;
import com.questrail.startline.persistence.ScheduleRepository;
import com.questrail.startline.transport.DatagramEndpoint;
import com.questrail.startline.transport.udp.UdpEventBroadcaster;
import com.questrail.startline.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * StartSchedulerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a committee boat's start scheduler.
 *
 * <p>Wires the repository, clocks, countdown ticker, committee log and the
 * optional UDP broadcast around a {@link RollingStartScheduler}. Every event
 * the scheduler commits goes, in this order, to the committee log, the
 * caller's own sink, the broadcast and the ticker.</p>
 */
public final class StartSchedulerRuntime {
    private final RollingStartScheduler scheduler;
    private final CountdownTicker ticker;
    private final UdpEventBroadcaster broadcaster;
    private final ScheduledExecutorService ownedExecutor;

    private StartSchedulerRuntime(RollingStartScheduler scheduler,
                                  CountdownTicker ticker,
                                  UdpEventBroadcaster broadcaster,
                                  ScheduledExecutorService ownedExecutor) {
        this.scheduler = scheduler;
        this.ticker = ticker;
        this.broadcaster = broadcaster;
        this.ownedExecutor = ownedExecutor;
    }

    public void start() {
        if (broadcaster != null) {
            broadcaster.start();
        }
    }

    public void stop() {
        ticker.disarmAll();
        if (broadcaster != null) {
            broadcaster.stop();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public StartScheduler scheduler() {
        return scheduler;
    }

    public CountdownTicker ticker() {
        return ticker;
    }

    public Optional<UdpEventBroadcaster> broadcaster() {
        return Optional.ofNullable(broadcaster);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SchedulerConfig config = SchedulerConfig.defaults();
        private BroadcastConfig broadcastConfig = BroadcastConfig.disabled();
        private ScheduleRepository repository;
        private StartEventSink eventSink;
        private CountdownListener countdownListener = (scheduleId, countdown) -> { };
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler monotonicScheduler;
        private DatagramEndpoint datagramEndpoint;
        private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();

        public Builder withConfig(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withBroadcast(BroadcastConfig broadcastConfig) {
            this.broadcastConfig = broadcastConfig;
            return this;
        }

        public Builder withRepository(ScheduleRepository repository) {
            this.repository = repository;
            return this;
        }

        /**
         * An additional sink receiving every event after the committee log.
         */
        public Builder withEventSink(StartEventSink sink) {
            this.eventSink = sink;
            return this;
        }

        public Builder withCountdownListener(CountdownListener listener) {
            this.countdownListener = listener;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        /**
         * Overrides the ticker's scheduler. When absent the runtime creates and
         * owns a single-threaded executor.
         */
        public Builder withMonotonicScheduler(MonotonicScheduler scheduler) {
            this.monotonicScheduler = scheduler;
            return this;
        }

        /**
         * Overrides the broadcast endpoint; by default a Netty endpoint is
         * bound according to the {@link BroadcastConfig}.
         */
        public Builder withDatagramEndpoint(DatagramEndpoint endpoint) {
            this.datagramEndpoint = endpoint;
            return this;
        }

        public Builder withIdGenerator(Supplier<String> idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public StartSchedulerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(broadcastConfig, "broadcastConfig");
            Objects.requireNonNull(countdownListener, "countdownListener");

            // 1. Storage and timing
            ScheduleRepository repo = repository != null ? repository : new InMemoryScheduleRepository();
            ScheduledExecutorService ownedExec = null;
            MonotonicScheduler timer = monotonicScheduler;
            if (timer == null) {
                ownedExec = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "startline-countdown");
                    t.setDaemon(true);
                    return t;
                });
                timer = new ScheduledExecutorScheduler(ownedExec, monotonicClock);
            }

            // 2. Sinks: committee log first, then the caller's
            Slf4jStartEventSink committeeLog = new Slf4jStartEventSink();
            List<StartEventSink> sinks = new ArrayList<>();
            sinks.add(committeeLog);
            if (eventSink != null) {
                sinks.add(eventSink);
            }

            // 3. Broadcast
            UdpEventBroadcaster broadcaster = null;
            if (broadcastConfig.enabled()) {
                DatagramEndpoint endpoint = datagramEndpoint != null
                        ? datagramEndpoint
                        : new NettyUdpDatagramEndpoint(broadcastConfig.bindAddress(), broadcastConfig.broadcast());
                broadcaster = new UdpEventBroadcaster(endpoint, broadcastConfig.target(),
                        new StartEventDatagramCodec(), null);
                sinks.add(broadcaster);
            }

            // 4. Countdown ticker, reading committed snapshots
            CountdownTicker ticker = new CountdownTicker(
                    repo::findById,
                    countdownListener,
                    timer,
                    monotonicClock,
                    wallClock,
                    config.countdownTickInterval(),
                    committeeLog);
            sinks.add(ticker);

            // 5. Scheduler
            RollingStartScheduler scheduler = new RollingStartScheduler(
                    repo,
                    config,
                    wallClock,
                    new CompositeStartEventSink(sinks),
                    idGenerator);

            return new StartSchedulerRuntime(scheduler, ticker, broadcaster, ownedExec);
        }
    }
}
