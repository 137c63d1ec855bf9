package com.sarkariexams.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;

import com.sarkariexams.backend.global.common.crypto.TokenDigests;
import com.sarkariexams.backend.modules.auth.domain.AdminUser;
import com.sarkariexams.backend.modules.auth.infrastructure.persistence.AdminBackupCodeRepository;
import com.sarkariexams.backend.modules.auth.infrastructure.totp.TotpVerifier;

import org.springframework.stereotype.Component;

/**
 * Accepts a current TOTP code or spends one unused backup code. Must run inside a transaction
 * so the backup code update commits with the login or step-up it unlocks.
 */
@Component
public class SecondFactorVerifier {

    private final TotpVerifier totpVerifier;
    private final AdminBackupCodeRepository adminBackupCodeRepository;
    private final Clock clock;

    public SecondFactorVerifier(TotpVerifier totpVerifier, AdminBackupCodeRepository adminBackupCodeRepository, Clock clock) {
        this.totpVerifier = totpVerifier;
        this.adminBackupCodeRepository = adminBackupCodeRepository;
        this.clock = clock;
    }

    public boolean verify(AdminUser user, String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        String trimmed = code.trim();
        if (totpVerifier.verify(user.getTwoFactorSecret(), trimmed)) {
            return true;
        }
        return adminBackupCodeRepository.consume(user.getId(), TokenDigests.sha256Hex(normalizeBackupCode(trimmed)),
                OffsetDateTime.now(clock)) == 1;
    }

    public static String normalizeBackupCode(String code) {
        return code.replace("-", "").replace(" ", "").toUpperCase(Locale.ROOT);
    }
}
