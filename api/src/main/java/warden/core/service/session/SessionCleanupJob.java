package warden.core.service.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SessionConfig;
import warden.core.port.in.SessionManagement;

/**
 * Background sweep that ends expired sessions.
 *
 * <p>Runs independently of live traffic. Overlapping runs are skipped, and the
 * repository guarantees each expired row is ended once even across instances.
 */
@ApplicationScoped
public class SessionCleanupJob {

    private static final Logger LOG = Logger.getLogger(SessionCleanupJob.class);

    private final SessionManagement sessionManagement;
    private final SessionConfig config;

    @Inject
    public SessionCleanupJob(SessionManagement sessionManagement, SessionConfig config) {
        this.sessionManagement = sessionManagement;
        this.config = config;
    }

    @Scheduled(
            every = "${warden.session.cleanup.interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> sweep() {
        if (!config.cleanup().enabled()) {
            return Uni.createFrom().voidItem();
        }

        LOG.debug("Sweeping expired sessions...");

        return sessionManagement
                .cleanupExpiredSessions()
                .invoke(count -> LOG.debugf("Session sweep completed: %d expired", count))
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Session sweep failed", e));
    }
}
