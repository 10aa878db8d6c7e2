package io.computehub.license;

/**
 * Thrown by {@link Entitlements#require(ProFeature)} when the feature is not unlocked.
 */
public class ProLicenseRequiredException extends RuntimeException {

    private final ProFeature feature;
    private final String purchaseUrl;

    public ProLicenseRequiredException(ProFeature feature, String purchaseUrl) {
        super(feature.getDisplayName() + " requires an active Pro License. "
            + "Activate your license in Settings > License or buy one at " + purchaseUrl);
        this.feature = feature;
        this.purchaseUrl = purchaseUrl;
    }

    public ProFeature getFeature() {
        return feature;
    }

    public String getPurchaseUrl() {
        return purchaseUrl;
    }
}
