package io.computehub.license.server;

import io.computehub.license.KeyParseResult;
import io.computehub.license.LicenseKey;
import io.computehub.license.LicenseKeyCodec;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Generates random license keys in the codec's format.
 *
 * <p>Each group draws from 36 symbols, so a key carries about 82 bits of randomness;
 * keys are not derivable from anything and are only valid once the ledger records them.
 */
public class LicenseKeyGenerator {

    private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();
    private static final int GROUPS = 4;
    private static final int GROUP_LENGTH = 4;

    private final LicenseKeyCodec codec;
    private final SecureRandom random;

    public LicenseKeyGenerator() {
        this(LicenseKeyCodec.DEFAULT, new SecureRandom());
    }

    public LicenseKeyGenerator(LicenseKeyCodec codec, SecureRandom random) {
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    public LicenseKey generate() {
        StringBuilder sb = new StringBuilder(codec.prefix());
        for (int g = 0; g < GROUPS; g++) {
            sb.append('-');
            for (int i = 0; i < GROUP_LENGTH; i++) {
                sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
            }
        }
        KeyParseResult parsed = codec.normalize(sb.toString());
        if (!parsed.isValid()) {
            throw new IllegalStateException("Generated key does not match " + codec.expectedFormat());
        }
        return parsed.key();
    }
}
