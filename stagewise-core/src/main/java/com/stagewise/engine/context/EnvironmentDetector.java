package com.stagewise.engine.context;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the {@code environment.*} variables from what the browser reports.
 * Detection is keyword based and intentionally coarse; rules only need to
 * tell phones from tablets from desktops.
 */
public final class EnvironmentDetector {

    static final String UNKNOWN = "unknown";

    private EnvironmentDetector() {
    }

    /**
     * @return {@code device}, {@code browser}, {@code user_agent} and
     *         {@code screen_size}; absent inputs yield {@code unknown}
     */
    public static Map<String, Object> detect(String userAgent, String screenSize) {
        Map<String, Object> environment = new LinkedHashMap<>();
        environment.put("device", device(userAgent));
        environment.put("browser", browser(userAgent));
        environment.put("user_agent", userAgent == null ? UNKNOWN : userAgent);
        environment.put("screen_size", screenSize == null || screenSize.isBlank() ? UNKNOWN : screenSize);
        return environment;
    }

    static String device(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return UNKNOWN;
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        // iPads and Android tablets also advertise "android"/"mobile" keywords
        if (ua.contains("ipad") || ua.contains("tablet")) {
            return "tablet";
        }
        if (ua.contains("mobile") || ua.contains("android") || ua.contains("iphone")) {
            return "mobile";
        }
        return "desktop";
    }

    static String browser(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return UNKNOWN;
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        if (ua.contains("edg/") || ua.contains("edge")) {
            return "edge";
        }
        if (ua.contains("firefox")) {
            return "firefox";
        }
        if (ua.contains("chrome") || ua.contains("crios")) {
            return "chrome";
        }
        if (ua.contains("safari")) {
            return "safari";
        }
        return "other";
    }
}
