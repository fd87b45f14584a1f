package warden.core.service.mfa;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.MfaConfig;

/**
 * Generates single-use backup codes.
 *
 * <p>Each code is 32 bits of {@link SecureRandom} output rendered as two groups of four
 * uppercase hex characters, e.g. {@code 3F9A-01BC}. Codes within one set are distinct.
 */
@ApplicationScoped
public class BackupCodeGenerator {

    private static final int CODE_BYTES = 4;
    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final SecureRandom secureRandom = new SecureRandom();
    private final int count;

    @Inject
    public BackupCodeGenerator(MfaConfig config) {
        this.count = config.backupCodeCount();
        if (count < 1) {
            throw new IllegalStateException("warden.mfa.backup-code-count must be positive: " + count);
        }
    }

    public List<String> generate() {
        Set<String> codes = new LinkedHashSet<>();
        while (codes.size() < count) {
            codes.add(generateOne());
        }
        return new ArrayList<>(codes);
    }

    /**
     * Normalize user input for comparison: trimmed and upper-cased.
     */
    public static String normalize(String code) {
        return code == null ? "" : code.strip().toUpperCase(Locale.ROOT);
    }

    private String generateOne() {
        byte[] bytes = new byte[CODE_BYTES];
        secureRandom.nextBytes(bytes);
        String hex = HEX.formatHex(bytes);
        return hex.substring(0, 4) + "-" + hex.substring(4);
    }
}
