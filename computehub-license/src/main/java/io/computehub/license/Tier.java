package io.computehub.license;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * ComputeHub entitlement tiers.
 *
 * <p>Only Pro is sold today ($49 one-time, lifetime access). The license server
 * reports the tier a key was issued for, so new tiers can be added here without
 * changing the activation protocol.
 */
public enum Tier {

    /**
     * No license activated.
     */
    FREE("Free", EnumSet.noneOf(ProFeature.class)),

    /**
     * ComputeHub Pro - every premium capability.
     */
    PRO("ComputeHub Pro", EnumSet.allOf(ProFeature.class));

    private final String displayName;
    private final Set<ProFeature> features;

    Tier(String displayName, Set<ProFeature> features) {
        this.displayName = displayName;
        this.features = features;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Set<ProFeature> getFeatures() {
        return Set.copyOf(features);
    }

    public boolean includes(ProFeature feature) {
        return features.contains(feature);
    }

    public boolean isPaid() {
        return this != FREE;
    }

    /**
     * Parse the tier name sent by the license server.
     *
     * <p>Unknown or missing names map to {@link #PRO}: the server only issues paid
     * keys, and a newer server may know tiers this client does not.
     *
     * @param name tier name from the wire (case-insensitive, may be null)
     * @return the matching tier
     */
    public static Tier fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return PRO;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Tier tier : values()) {
            if (tier.name().equals(normalized)) {
                return tier;
            }
        }
        return PRO;
    }
}
