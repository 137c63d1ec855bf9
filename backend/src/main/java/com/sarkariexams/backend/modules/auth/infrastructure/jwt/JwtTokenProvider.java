package com.sarkariexams.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final byte[] CSRF_KEY_LABEL = "sarkariexams-admin-csrf".getBytes(StandardCharsets.UTF_8);

    private final SecretKey sessionKey;
    private final SecretKey csrfKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        byte[] keyBytes = decode(secretString);
        this.sessionKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
        byte[] csrfBytes = Arrays.copyOf(keyBytes, keyBytes.length + CSRF_KEY_LABEL.length);
        System.arraycopy(CSRF_KEY_LABEL, 0, csrfBytes, keyBytes.length, CSRF_KEY_LABEL.length);
        this.csrfKey = new SecretKeySpec(csrfBytes, HMAC_SHA_256);
    }

    public SecretKey getSessionKey() {
        return sessionKey;
    }

    public SecretKey getCsrfKey() {
        return csrfKey;
    }

    private static byte[] decode(String secretString) {
        try {
            return Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            return secretString.getBytes(StandardCharsets.UTF_8);
        }
    }
}
