package warden.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import warden.core.config.AuditConfig;
import warden.core.model.audit.SecurityEvent;
import warden.core.port.out.SecurityEventPublisher;
import warden.spi.SecurityEventHandler;

/**
 * Dispatches recorded security events to registered handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} and invoked in priority order
 * (highest priority first). Events are dispatched on a single background thread so
 * handlers see them in the order they were recorded and never block the caller.
 *
 * <p>When dispatch is disabled, events are only kept in the audit store.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityEventPublisher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final MeterRegistry meterRegistry;
    private final boolean enabled;

    private List<SecurityEventHandler> handlers;
    private ExecutorService executor;

    @Inject
    public SecurityEventDispatcher(AuditConfig config, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.enabled = config != null && config.dispatchEnabled();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.debug("Security event dispatch is disabled - events are stored only");
            return;
        }

        var loadedHandlers = ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        // Inject MeterRegistry into MetricsSecurityEventHandler
        for (var handler : loadedHandlers) {
            if (handler instanceof MetricsSecurityEventHandler metricsHandler) {
                metricsHandler.setMeterRegistry(meterRegistry);
            }
        }

        handlers = loadedHandlers.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();

        if (handlers.isEmpty()) {
            LOG.warn("No security event handlers found - events will only be stored");
        } else {
            LOG.infof(
                    "Loaded %d security event handler(s): %s",
                    handlers.size(),
                    handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }

        executor = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "security-event-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Drain pending events, then close every handler.
     */
    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warn("Security event dispatcher did not drain in time, dropping pending events");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
        if (handlers != null) {
            handlers.forEach(handler -> {
                try {
                    handler.close();
                } catch (Exception e) {
                    LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
                }
            });
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Dispatch a security event to all registered handlers.
     *
     * <p>Events are dispatched asynchronously. A failing handler is logged and does not
     * prevent the remaining handlers from seeing the event.
     *
     * @param event the stored event
     */
    @Override
    public void publish(SecurityEvent event) {
        if (!enabled || handlers == null || handlers.isEmpty()) {
            return;
        }

        try {
            executor.submit(() -> {
                for (var handler : handlers) {
                    try {
                        handler.handle(event);
                    } catch (Exception e) {
                        LOG.warnf("Handler %s failed to process event: %s", handler.name(), e.getMessage());
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.debugf("Dispatcher is shutting down, event %d not dispatched", event.sequence());
        }
    }

    /**
     * Get the list of registered handlers.
     *
     * @return list of handlers (empty if disabled)
     */
    public List<SecurityEventHandler> getHandlers() {
        return handlers != null ? handlers : List.of();
    }
}
