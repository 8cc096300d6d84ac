package io.eventrelay.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.bus.EventSink;
import io.eventrelay.bus.SubscriptionBroker;
import io.eventrelay.completion.CompletionRegistry;
import io.eventrelay.completion.CompletionWorker;
import io.eventrelay.completion.EchoCompletionWorker;
import io.eventrelay.completion.ScriptCompletionWorker;
import io.eventrelay.config.DaemonSettings;
import io.eventrelay.config.EventRelayConfig;
import io.eventrelay.error.EventRelayError;
import io.eventrelay.error.ValidationException;
import io.eventrelay.log.EventLog;
import io.eventrelay.log.EventPatterns;
import io.eventrelay.log.JournalHealth;
import io.eventrelay.model.Event;
import io.eventrelay.observation.ObservationManager;
import io.eventrelay.observation.PatternAnalyzer;
import io.eventrelay.observation.ReplayEngine;
import io.eventrelay.plugin.DispatchOutcome;
import io.eventrelay.plugin.EventDispatcher;
import io.eventrelay.plugin.EventPlugin;
import io.eventrelay.plugin.HandlerRegistry;
import io.eventrelay.plugin.builtin.CompletionPlugin;
import io.eventrelay.plugin.builtin.MonitorPlugin;
import io.eventrelay.plugin.builtin.ObservationPlugin;
import io.eventrelay.plugin.builtin.SystemPlugin;
import io.eventrelay.storage.Database;
import io.eventrelay.storage.SqliteEventJournal;
import io.eventrelay.transport.HttpEventAdapter;
import io.eventrelay.transport.RequestHandler;
import io.eventrelay.transport.SocketServer;
import io.eventrelay.transport.WireProtocol;
import io.eventrelay.transport.WireRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns every daemon component and routes requests: each request is logged, then
 * dispatched to the handlers registered for its name.
 */
public final class EventRelayDaemon implements RequestHandler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventRelayDaemon.class);
    private static final long SHUTDOWN_GRACE_MS = 250L;

    private final EventRelayConfig config;
    private final DaemonSettings settings;
    private final Clock clock;
    private final Database database;
    private final EventLog eventLog;
    private final HandlerRegistry handlers = new HandlerRegistry();
    private final EventDispatcher dispatcher;
    private final CompletionRegistry completions;
    private final SubscriptionBroker broker;
    private final ObservationManager observations;
    private final PatternAnalyzer analyzer;
    private final ReplayEngine replays;
    private final ExecutorService requestExecutor;
    private final List<AutoCloseable> transports = new CopyOnWriteArrayList<>();
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final long startedAtMs;
    private boolean initialized;
    private boolean closed;

    public EventRelayDaemon(EventRelayConfig config) {
        this(config, DaemonSettings.load(config.settingsFile()), null, Clock.systemUTC());
    }

    public EventRelayDaemon(EventRelayConfig config, DaemonSettings settings, CompletionWorker worker, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.database = new Database(config);
        this.eventLog = new EventLog(
                new SqliteEventJournal(database),
                this.clock,
                settings.eventRetention(),
                settings.journalRetryBudget(),
                settings.journalRetryBackoffMs()
        );
        this.dispatcher = new EventDispatcher(handlers);
        this.completions = new CompletionRegistry(
                worker == null ? defaultWorker(settings) : worker,
                eventLog,
                settings,
                this.clock
        );
        this.broker = new SubscriptionBroker(this.clock);
        this.observations = new ObservationManager(eventLog);
        this.analyzer = new PatternAnalyzer(eventLog);
        this.replays = new ReplayEngine(eventLog, settings.replayMaxEvents());
        AtomicInteger threadNo = new AtomicInteger();
        this.requestExecutor = Executors.newFixedThreadPool(settings.requestThreads(), r -> {
            Thread t = new Thread(r, "eventrelay-request-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.startedAtMs = this.clock.millis();
    }

    public synchronized void init() {
        if (initialized) {
            return;
        }
        database.init();
        eventLog.recover();
        eventLog.addListener(broker);
        eventLog.addListener(observations);
        handlers.install(new SystemPlugin(this::health, this::requestShutdown));
        handlers.install(new MonitorPlugin(eventLog, broker));
        handlers.install(new CompletionPlugin(completions));
        handlers.install(new ObservationPlugin(observations, analyzer, replays));
        initialized = true;
        log.info("EventRelay initialized at {} (worker={}, lastSequence={})",
                config.rootDir(), completions.workerId(), eventLog.lastSequence());
    }

    public void installPlugin(EventPlugin plugin) {
        handlers.install(plugin);
        log.info("Installed plugin {}", plugin.id());
    }

    public SocketServer startSocket(Path socketFile) throws IOException {
        SocketServer server = SocketServer.unix(socketFile, this, requestExecutor);
        server.start();
        transports.add(server);
        return server;
    }

    public SocketServer startTcp(String host, int port) throws IOException {
        SocketServer server = SocketServer.tcp(host, port, this, requestExecutor);
        server.start();
        transports.add(server);
        return server;
    }

    public HttpEventAdapter startHttp(String host, int port) throws IOException {
        HttpEventAdapter adapter = new HttpEventAdapter(host, port, this, this::health, requestExecutor);
        adapter.start();
        transports.add(adapter);
        return adapter;
    }

    @Override
    public ObjectNode handle(WireRequest request, EventSink sink) {
        String correlationId = request.correlationId();
        try {
            String name = EventPatterns.validateEventName(request.event());
            // a poll under a notification name must not look like the notification itself
            boolean logged = !handlers.isNotification(name);
            Event event = logged
                    ? eventLog.append(name, request.data(), request.origin())
                    : new Event(0L, name, request.data(), clock.instant(), request.origin());
            DispatchOutcome outcome = dispatcher.dispatch(event, sink);
            if (outcome.failed()) {
                return WireProtocol.error(name, correlationId, outcome.errorKind(), outcome.error());
            }
            ObjectNode frame = WireProtocol.response(name, correlationId, outcome.response());
            if (logged) {
                frame.put("sequence_no", event.sequenceNo());
            }
            if (!outcome.handled()) {
                frame.put("handled", false);
            }
            return frame;
        } catch (ValidationException e) {
            return WireProtocol.error(request.event(), correlationId, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            if (e instanceof EventRelayError) {
                EventRelayError error = (EventRelayError) e;
                return WireProtocol.error(request.event(), correlationId, error.kind(), error.getMessage());
            }
            throw e;
        }
    }

    @Override
    public void onDisconnect(EventSink sink) {
        int subscriptions = broker.disconnectSink(sink);
        int observers = observations.disconnectSink(sink);
        if (subscriptions > 0 || observers > 0) {
            log.debug("Connection {} gone: dropped {} subscriptions, {} observer channels",
                    sink.id(), subscriptions, observers);
        }
    }

    /** Logs and dispatches an event produced inside the process. */
    public DispatchOutcome emit(String name, ObjectNode data, String origin) {
        Event event = eventLog.append(name, data, origin);
        return dispatcher.dispatch(event, null);
    }

    public HealthOutcome health() {
        JournalHealth journal = eventLog.journalHealth();
        return new HealthOutcome(
                journal.degraded() ? "degraded" : "ok",
                eventLog.lastSequence(),
                eventLog.size(),
                journal.degraded(),
                journal.failures(),
                journal.dropped(),
                completions.outstanding(),
                broker.size(),
                observations.size(),
                replays.active(),
                dispatcher.handlerFailures(),
                clock.millis() - startedAtMs,
                Instant.ofEpochMilli(clock.millis()).toString()
        );
    }

    public void requestShutdown() {
        log.info("Shutdown requested");
        CompletableFuture.runAsync(shutdownLatch::countDown,
                CompletableFuture.delayedExecutor(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS));
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public boolean awaitShutdown(Duration timeout) throws InterruptedException {
        return shutdownLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public EventRelayConfig config() {
        return config;
    }

    public DaemonSettings settings() {
        return settings;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public EventDispatcher dispatcher() {
        return dispatcher;
    }

    public CompletionRegistry completions() {
        return completions;
    }

    public SubscriptionBroker broker() {
        return broker;
    }

    public ObservationManager observations() {
        return observations;
    }

    public ReplayEngine replays() {
        return replays;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<AutoCloseable> open = new ArrayList<>(transports);
        transports.clear();
        for (AutoCloseable transport : open) {
            try {
                transport.close();
            } catch (Exception e) {
                log.warn("Failed to close transport {}", transport.getClass().getSimpleName(), e);
            }
        }
        replays.close();
        completions.close();
        requestExecutor.shutdownNow();
        eventLog.close();
        shutdownLatch.countDown();
        log.info("EventRelay stopped");
    }

    private static CompletionWorker defaultWorker(DaemonSettings settings) {
        if (settings.completionCommand().isEmpty()) {
            return new EchoCompletionWorker();
        }
        return new ScriptCompletionWorker(settings.completionCommand(), settings.completionCommandTimeoutMs());
    }

    public record HealthOutcome(
            String status,
            long lastSequence,
            int retainedEvents,
            boolean journalDegraded,
            long journalFailures,
            long journalDropped,
            int outstandingJobs,
            int subscribers,
            int observations,
            int activeReplays,
            long handlerFailures,
            long uptimeMs,
            String checkedAt
    ) {
    }
}
