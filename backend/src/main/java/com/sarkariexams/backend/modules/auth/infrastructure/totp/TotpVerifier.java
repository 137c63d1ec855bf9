package com.sarkariexams.backend.modules.auth.infrastructure.totp;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Locale;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

/**
 * RFC 6238 time-based one-time passwords: HMAC-SHA1, 30 second step, 6 digits, one step of
 * drift accepted on either side.
 */
@Component
public class TotpVerifier {

    private static final String HMAC_SHA1 = "HmacSHA1";
    private static final long STEP_SECONDS = 30L;
    private static final int DIGITS = 6;
    private static final int DRIFT_STEPS = 1;
    private static final String BASE32_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";

    private final Clock clock;

    public TotpVerifier(Clock clock) {
        this.clock = clock;
    }

    public boolean verify(String base32Secret, String code) {
        if (base32Secret == null || base32Secret.isBlank() || code == null) {
            return false;
        }
        String normalized = code.replace(" ", "");
        if (normalized.length() != DIGITS || !normalized.chars().allMatch(Character::isDigit)) {
            return false;
        }
        byte[] key = decodeBase32(base32Secret);
        long counter = clock.instant().getEpochSecond() / STEP_SECONDS;
        for (int offset = -DRIFT_STEPS; offset <= DRIFT_STEPS; offset++) {
            String expected = generate(key, counter + offset);
            if (MessageDigest.isEqual(expected.getBytes(), normalized.getBytes())) {
                return true;
            }
        }
        return false;
    }

    public String currentCode(String base32Secret) {
        return generate(decodeBase32(base32Secret), clock.instant().getEpochSecond() / STEP_SECONDS);
    }

    static String generate(byte[] key, long counter) {
        byte[] hash;
        try {
            Mac mac = Mac.getInstance(HMAC_SHA1);
            mac.init(new SecretKeySpec(key, HMAC_SHA1));
            hash = mac.doFinal(ByteBuffer.allocate(Long.BYTES).putLong(counter).array());
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA1 unavailable", ex);
        }
        int offset = hash[hash.length - 1] & 0x0f;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);
        int otp = binary % 1_000_000;
        return String.format(Locale.ROOT, "%06d", otp);
    }

    static byte[] decodeBase32(String value) {
        String clean = value.trim().replace("=", "").replace(" ", "").toUpperCase(Locale.ROOT);
        ByteBuffer out = ByteBuffer.allocate(clean.length() * 5 / 8);
        int buffer = 0;
        int bits = 0;
        for (char c : clean.toCharArray()) {
            int index = BASE32_ALPHABET.indexOf(c);
            if (index < 0) {
                throw new IllegalArgumentException("Invalid Base32 character: " + c);
            }
            buffer = (buffer << 5) | index;
            bits += 5;
            if (bits >= 8) {
                out.put((byte) ((buffer >> (bits - 8)) & 0xff));
                bits -= 8;
            }
        }
        return out.array();
    }
}
