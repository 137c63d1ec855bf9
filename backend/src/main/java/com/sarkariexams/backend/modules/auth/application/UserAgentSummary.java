package com.sarkariexams.backend.modules.auth.application;

import java.util.Locale;

public record UserAgentSummary(String device, String browser, String os) {

    private static final String UNKNOWN = "unknown";

    public static UserAgentSummary parse(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return new UserAgentSummary(UNKNOWN, UNKNOWN, UNKNOWN);
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        return new UserAgentSummary(device(ua), browser(ua), os(ua));
    }

    private static String device(String ua) {
        if (ua.contains("ipad") || ua.contains("tablet")) {
            return "tablet";
        }
        if (ua.contains("mobi") || ua.contains("iphone") || ua.contains("android")) {
            return "mobile";
        }
        return "desktop";
    }

    private static String browser(String ua) {
        if (ua.contains("edg/")) {
            return "edge";
        }
        if (ua.contains("opr/") || ua.contains("opera")) {
            return "opera";
        }
        if (ua.contains("firefox/")) {
            return "firefox";
        }
        if (ua.contains("chrome/")) {
            return "chrome";
        }
        if (ua.contains("safari/")) {
            return "safari";
        }
        return UNKNOWN;
    }

    private static String os(String ua) {
        if (ua.contains("windows")) {
            return "windows";
        }
        if (ua.contains("iphone") || ua.contains("ipad") || ua.contains("ios")) {
            return "ios";
        }
        if (ua.contains("android")) {
            return "android";
        }
        if (ua.contains("mac os")) {
            return "macos";
        }
        if (ua.contains("linux")) {
            return "linux";
        }
        return UNKNOWN;
    }
}
