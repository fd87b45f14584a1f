package warden.core.model.lockout;

import java.util.Locale;

/**
 * Kind of identifier a lockout record tracks.
 */
public enum LockoutType {
    EMAIL,
    IP;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LockoutType fromValue(String value) {
        for (LockoutType type : values()) {
            if (type.value().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown lockout type: " + value);
    }
}
