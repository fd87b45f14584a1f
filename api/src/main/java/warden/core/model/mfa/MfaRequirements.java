package warden.core.model.mfa;

import java.util.List;

/**
 * Second-factor policy for a role.
 *
 * @param required whether the role must use a second factor
 * @param methods  methods the role may use
 */
public record MfaRequirements(boolean required, List<MfaType> methods) {

    public MfaRequirements {
        methods = List.copyOf(methods);
    }
}
