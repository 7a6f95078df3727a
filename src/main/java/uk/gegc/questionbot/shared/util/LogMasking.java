package uk.gegc.questionbot.shared.util;

/**
 * Masks personal data and secrets before they reach the logs.
 */
public final class LogMasking {

    private LogMasking() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String maskEmail(String email) {
        if (email == null || email.isEmpty()) {
            return "***";
        }
        int atIndex = email.indexOf('@');
        if (atIndex <= 1) {
            return "***@" + (atIndex > 0 ? email.substring(atIndex + 1) : "***");
        }
        return email.charAt(0) + "***@" + email.substring(atIndex + 1);
    }

    /**
     * Passcodes are short, so only the last digit survives.
     */
    public static String maskCode(String code) {
        if (code == null || code.length() < 2) {
            return "***";
        }
        return "*****" + code.charAt(code.length() - 1);
    }
}
