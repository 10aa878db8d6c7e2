package io.computehub.license;

/**
 * Premium capabilities unlocked by a Pro license.
 *
 * <p>The features themselves live elsewhere in ComputeHub; this enum only names
 * them so gating checks and the license settings page agree on the list.
 */
public enum ProFeature {

    BATCH_OPERATIONS("Batch Operations", "Start, stop, or delete multiple deployments at once"),
    AUTOMATION_ENGINE("Automation Engine", "Auto-restart on failure, cost limits, health checks"),
    EMAIL_NOTIFICATIONS("Email Notifications", "Get notified about deployment events"),
    TELEGRAM_NOTIFICATIONS("Telegram Notifications", "Receive alerts via Telegram Bot"),
    WEBHOOK_INTEGRATION("Webhook Integration", "Integrate with your own systems"),
    ADVANCED_MONITORING("Advanced Monitoring", "GPU utilization charts and trends"),
    ADVANCED_TEMPLATES("Advanced Templates", "ComfyUI, SD WebUI, Llama optimized"),
    EMAIL_SUPPORT("Email Support", "Priority email support");

    private final String displayName;
    private final String description;

    ProFeature(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
