package warden.core.service.session;

import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.jboss.logging.Logger;

import warden.core.config.SessionConfig;
import warden.core.model.session.Session;
import warden.core.util.Redaction;

/**
 * Flags session activity that does not match the client the session was issued to.
 *
 * <p>Detection rules, in order:
 * <ol>
 *   <li>An IP address different from the one bound at creation is suspicious.</li>
 *   <li>Otherwise, when both user agents are long enough to be meaningful, they are
 *       compared. With similarity scoring enabled a Jaro-Winkler similarity below the
 *       threshold is suspicious. With it disabled, a length difference above the
 *       threshold where neither string contains the other is suspicious.</li>
 * </ol>
 *
 * <p>Detection is advisory: it never throws and never ends a session.
 */
@ApplicationScoped
public class SuspiciousActivityDetector {

    private static final Logger LOG = Logger.getLogger(SuspiciousActivityDetector.class);

    private static final JaroWinklerSimilarity JARO_WINKLER = new JaroWinklerSimilarity();

    private final SessionConfig.SuspiciousActivity config;

    @Inject
    public SuspiciousActivityDetector(SessionConfig config) {
        this.config = config.suspiciousActivity();
    }

    /**
     * Check incoming client metadata against a session.
     *
     * @param session      the stored session
     * @param newIp        IP address of the current request
     * @param newUserAgent user agent of the current request (may be null)
     * @return true if the activity looks suspicious
     */
    public boolean detect(Session session, String newIp, String newUserAgent) {
        try {
            if (!Objects.equals(session.ipAddress(), newIp)) {
                LOG.debugf("IP change on session %s", Redaction.sessionId(session.id()));
                return true;
            }
            return userAgentChanged(session.userAgent(), newUserAgent);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Suspicious activity detection failed for session %s", Redaction.sessionId(session.id()));
            return false;
        }
    }

    private boolean userAgentChanged(String original, String current) {
        if (original == null || current == null) {
            return false;
        }
        int minLength = config.userAgentMinLength();
        if (original.length() < minLength || current.length() < minLength) {
            return false;
        }
        if (config.similarityEnabled()) {
            return similarity(original, current) < config.similarityThreshold();
        }
        int lengthDifference = Math.abs(original.length() - current.length());
        return lengthDifference > config.lengthDifferenceThreshold()
                && !original.contains(current)
                && !current.contains(original);
    }

    // 1.0 for identical strings
    static double similarity(String left, String right) {
        return JARO_WINKLER.apply(left, right);
    }
}
