package com.trackdeck.common.util;

/**
 * Conversions between seconds and the "MM:SS" / "HH:MM:SS" strings shown to the user.
 */
public final class TimeFormat {
    public static final String UNKNOWN = "00:00";

    private TimeFormat() {
    }

    public static String minutesSeconds(long totalSeconds) {
        if (totalSeconds < 0)
            totalSeconds = 0;
        return String.format("%02d:%02d", totalSeconds / 60, totalSeconds % 60);
    }

    public static String hoursMinutesSeconds(long totalSeconds) {
        if (totalSeconds < 0)
            totalSeconds = 0;
        return String.format("%02d:%02d:%02d", totalSeconds / 3600, (totalSeconds % 3600) / 60, totalSeconds % 60);
    }

    /**
     * Parses "SS", "MM:SS" or "HH:MM:SS". Unparseable parts are skipped, an empty
     * or null input gives 0.
     */
    public static long parseSeconds(String text) {
        if (text == null || text.isBlank())
            return 0;
        long total = 0;
        for (String part : text.trim().split(":")) {
            String digits = part.trim();
            if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit))
                continue;
            total = total * 60 + Long.parseLong(digits);
        }
        return total;
    }
}
