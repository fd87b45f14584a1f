package warden.core.model.audit;

import java.util.Locale;

/**
 * Closed set of security event types written to the audit log.
 */
public enum SecurityEventType {
    SESSION_CREATED,
    SESSION_INVALIDATED,
    SESSION_LIMIT_EXCEEDED,
    SESSIONS_EXPIRED,
    SUSPICIOUS_ACTIVITY,
    LOGIN_FAILED,
    ACCOUNT_LOCKED,
    ACCOUNT_UNLOCKED,
    MFA_SETUP_INITIATED,
    MFA_ENABLED,
    MFA_VERIFIED,
    MFA_FAILED,
    BACKUP_CODE_USED,
    BACKUP_CODES_REGENERATED,
    MFA_DISABLED,
    PERMISSION_GRANTED,
    PERMISSION_REVOKED,
    PERMISSIONS_REPLACED;

    /**
     * Wire value, e.g. {@code account_locked}.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
