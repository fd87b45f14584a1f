package warden.core.model.mfa;

/**
 * Outcome of verifying a TOTP token or backup code.
 *
 * @param valid                whether the token was accepted
 * @param error                reason for rejection (null when valid)
 * @param usedBackupCode       whether a backup code was consumed
 * @param remainingBackupCodes unused backup codes left after this call
 */
public record MfaVerificationResult(boolean valid, String error, boolean usedBackupCode, int remainingBackupCodes) {

    public static final String NOT_CONFIGURED = "TOTP not configured";
    public static final String INVALID_TOKEN = "Invalid token";

    public static MfaVerificationResult totpAccepted(int remainingBackupCodes) {
        return new MfaVerificationResult(true, null, false, remainingBackupCodes);
    }

    public static MfaVerificationResult backupCodeAccepted(int remainingBackupCodes) {
        return new MfaVerificationResult(true, null, true, remainingBackupCodes);
    }

    public static MfaVerificationResult rejected(String error, int remainingBackupCodes) {
        return new MfaVerificationResult(false, error, false, remainingBackupCodes);
    }

    public static MfaVerificationResult notConfigured() {
        return new MfaVerificationResult(false, NOT_CONFIGURED, false, 0);
    }
}
