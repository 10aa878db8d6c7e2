package io.computehub.license;

/**
 * Outcome of one verification attempt.
 *
 * @param kind which terminal state the attempt reached
 * @param record the activation record after the attempt (null if none remains)
 */
public record Verdict(Kind kind, ActivationRecord record) {

    public enum Kind {

        /**
         * The server confirmed the binding to this installation.
         */
        VERIFIED,

        /**
         * The server reported the key bound elsewhere or not bound; local record cleared.
         */
        REVOKED,

        /**
         * Server unreachable; cached record is within the staleness window.
         */
        FALLBACK_ENTITLED,

        /**
         * Server unreachable and the cached record is too old to trust.
         */
        FALLBACK_DENIED,

        /**
         * Nothing activated on this installation; no server call was made.
         */
        NOT_ACTIVATED
    }

    public boolean entitled() {
        return kind == Kind.VERIFIED || kind == Kind.FALLBACK_ENTITLED;
    }

    public boolean cached() {
        return kind == Kind.FALLBACK_ENTITLED;
    }
}
