package com.sarkariexams.backend.modules.auth.infrastructure.totp;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class TotpVerifierTest {

    // RFC 6238 appendix B seed "12345678901234567890"
    private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    @Test
    void generatesRfcReferenceValuesTruncatedToSixDigits() {
        assertThat(verifierAt(59).currentCode(RFC_SECRET)).isEqualTo("287082");
        assertThat(verifierAt(1111111109).currentCode(RFC_SECRET)).isEqualTo("081804");
        assertThat(verifierAt(1234567890).currentCode(RFC_SECRET)).isEqualTo("005924");
        assertThat(verifierAt(2000000000).currentCode(RFC_SECRET)).isEqualTo("279037");
    }

    @Test
    void acceptsOneStepOfDriftEitherSide() {
        assertThat(verifierAt(59).verify(RFC_SECRET, "287082")).isTrue();
        assertThat(verifierAt(89).verify(RFC_SECRET, "287082")).isTrue();
        assertThat(verifierAt(119).verify(RFC_SECRET, "287082")).isFalse();
    }

    @Test
    void toleratesSpacesInsideTheCode() {
        assertThat(verifierAt(59).verify(RFC_SECRET, "287 082")).isTrue();
    }

    @Test
    void rejectsMalformedCodesAndMissingSecret() {
        TotpVerifier verifier = verifierAt(59);

        assertThat(verifier.verify(RFC_SECRET, "28708")).isFalse();
        assertThat(verifier.verify(RFC_SECRET, "28708a")).isFalse();
        assertThat(verifier.verify(RFC_SECRET, null)).isFalse();
        assertThat(verifier.verify(null, "287082")).isFalse();
        assertThat(verifier.verify(" ", "287082")).isFalse();
    }

    @Test
    void decodesLowercaseAndPaddedBase32() {
        byte[] decoded = TotpVerifier.decodeBase32("gezdgnbvgy3tqojqgezdgnbvgy3tqojq====");

        assertThat(new String(decoded)).isEqualTo("12345678901234567890");
    }

    private static TotpVerifier verifierAt(long epochSecond) {
        return new TotpVerifier(Clock.fixed(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC));
    }
}
