package io.computehub.license;

/**
 * Result of a license deactivation operation.
 *
 * @param success whether the installation no longer holds the license
 * @param wasActive whether a license was activated before the call
 * @param error user-facing message if failed
 * @param errorCode machine-readable error code
 */
public record DeactivationResult(
    boolean success,
    boolean wasActive,
    String error,
    ErrorCode errorCode
) {

    public enum ErrorCode {
        NONE,
        NETWORK_REQUIRED_FOR_DEACTIVATION
    }

    /**
     * The license was released at the server and removed locally.
     */
    public static DeactivationResult deactivated() {
        return new DeactivationResult(true, true, null, ErrorCode.NONE);
    }

    /**
     * Nothing was activated; trivially successful.
     */
    public static DeactivationResult notActive() {
        return new DeactivationResult(true, false, null, ErrorCode.NONE);
    }

    /**
     * The server could not confirm the release; the license stays active here.
     */
    public static DeactivationResult networkRequired() {
        return new DeactivationResult(
            false, true,
            "Could not confirm deactivation with the license server. Try again.",
            ErrorCode.NETWORK_REQUIRED_FOR_DEACTIVATION
        );
    }
}
