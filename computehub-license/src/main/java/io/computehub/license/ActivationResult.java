package io.computehub.license;

/**
 * Result of a license activation operation.
 *
 * @param success whether activation succeeded
 * @param status the entitlement status after the operation
 * @param error user-facing message if failed
 * @param errorCode machine-readable error code
 */
public record ActivationResult(
    boolean success,
    StatusView status,
    String error,
    ErrorCode errorCode
) {

    public enum ErrorCode {
        NONE,
        INVALID_FORMAT,
        INVALID_KEY,
        ALREADY_ACTIVATED_ELSEWHERE,
        ANOTHER_KEY_ACTIVE,
        NETWORK_REQUIRED_FOR_ACTIVATION
    }

    /**
     * Successful activation.
     */
    public static ActivationResult success(StatusView status) {
        return new ActivationResult(true, status, null, ErrorCode.NONE);
    }

    /**
     * Failed activation with error code.
     */
    public static ActivationResult failure(String error, ErrorCode code, StatusView status) {
        return new ActivationResult(false, status, error, code);
    }
}
