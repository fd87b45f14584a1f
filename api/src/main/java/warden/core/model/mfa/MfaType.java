package warden.core.model.mfa;

import java.util.Locale;

/**
 * Supported second-factor methods.
 */
public enum MfaType {
    TOTP;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
