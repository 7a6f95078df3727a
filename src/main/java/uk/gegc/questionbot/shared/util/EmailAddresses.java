package uk.gegc.questionbot.shared.util;

import java.util.Locale;

/**
 * Normalisation and a deliberately loose syntax check for user-typed email addresses.
 * <p>
 * Addresses are compared only in normalised form (trimmed, lower-cased), so every lookup and insert
 * goes through {@link #normalize(String)} first.
 */
public final class EmailAddresses {

    private EmailAddresses() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts exactly one {@code @}, a non-empty local part, and a domain with an inner dot.
     * Whitespace anywhere is rejected.
     */
    public static boolean isValid(String email) {
        if (email == null || email.isEmpty()) {
            return false;
        }
        for (int i = 0; i < email.length(); i++) {
            if (Character.isWhitespace(email.charAt(i))) {
                return false;
            }
        }
        int at = email.indexOf('@');
        if (at <= 0 || at != email.lastIndexOf('@')) {
            return false;
        }
        String domain = email.substring(at + 1);
        int dot = domain.indexOf('.');
        return dot > 0 && dot < domain.length() - 1;
    }

    public static boolean hasDomain(String email, String domain) {
        if (email == null || domain == null || domain.isBlank()) {
            return false;
        }
        return email.endsWith("@" + domain.toLowerCase(Locale.ROOT));
    }
}
