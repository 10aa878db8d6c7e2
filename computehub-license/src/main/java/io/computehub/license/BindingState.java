package io.computehub.license;

import java.util.Locale;

/**
 * Where the license server says a key is currently bound.
 */
public enum BindingState {

    BOUND_TO_THIS,
    BOUND_ELSEWHERE,
    NOT_BOUND;

    /**
     * Wire name, e.g. {@code bound_to_this}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire name.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static BindingState fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("binding state is missing");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
