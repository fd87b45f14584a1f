package warden.core.model.mfa;

import java.util.List;

/**
 * Material returned once when a user starts TOTP setup.
 *
 * <p>This is the only time the plaintext secret and backup codes leave the service.
 *
 * @param secret         base32 shared secret (32 characters)
 * @param qrCodeUrl      {@code otpauth://} provisioning URI
 * @param manualEntryKey the secret grouped in blocks of four for manual entry
 * @param backupCodes    single-use backup codes in {@code XXXX-XXXX} form
 */
public record TotpSetup(String secret, String qrCodeUrl, String manualEntryKey, List<String> backupCodes) {

    public TotpSetup {
        backupCodes = List.copyOf(backupCodes);
    }

    @Override
    public String toString() {
        return "TotpSetup[qrCodeUrl=<redacted>, backupCodes=" + backupCodes.size() + "]";
    }
}
