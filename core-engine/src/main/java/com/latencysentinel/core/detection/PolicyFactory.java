package com.latencysentinel.core.detection;

import com.latencysentinel.core.config.DetectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Factory that maps a configured policy name to an {@link AnomalyPolicy}.
 *
 * <p>
 * Register new policy names here.
 * </p>
 *
 * @since 1.0.0
 */
public final class PolicyFactory {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyFactory.class);

    private PolicyFactory() {
        // utility class — not instantiable
    }

    /**
     * Create the policy named by {@code settings}.
     *
     * @param settings detection settings; must not be {@code null}
     * @return the configured policy
     * @throws NullPointerException     if {@code settings} or its policy is
     *                                  {@code null}
     * @throws IllegalArgumentException if the policy name is unknown
     */
    public static AnomalyPolicy create(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        return create(settings.getPolicy());
    }

    /**
     * Create a policy by name ({@code relative} or {@code sigma-band},
     * case-insensitive).
     *
     * @param name policy name; must not be {@code null}
     * @return a new policy instance
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AnomalyPolicy create(String name) {
        Objects.requireNonNull(name, "Policy name must not be null");

        AnomalyPolicy policy = switch (name.trim().toLowerCase(Locale.ROOT)) {
            case DetectionSettings.POLICY_RELATIVE -> new RelativeMagnitudePolicy();
            case DetectionSettings.POLICY_SIGMA_BAND -> new SigmaBandPolicy();
            default -> throw new IllegalArgumentException(
                    "Unknown policy: '" + name + "'. Supported: "
                            + DetectionSettings.POLICY_RELATIVE + ", "
                            + DetectionSettings.POLICY_SIGMA_BAND);
        };
        LOG.debug("Created policy {}", policy);
        return policy;
    }
}
