package io.mailagenda.utils;

import io.mailagenda.core.ValidationException.Problem;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Practical address validation: not RFC 5322, but catches typos before a job is created.
 *
 * <p>Addresses on a well-known misspelled domain ("gamil.com") are rejected with a suggestion
 * rather than delivered to the wrong mailbox.
 */
public final class EmailAddressValidator {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private static final Map<String, String> COMMON_DOMAIN_TYPOS = Map.ofEntries(
            Map.entry("gamil.com", "gmail.com"),
            Map.entry("gmal.com", "gmail.com"),
            Map.entry("gmial.com", "gmail.com"),
            Map.entry("gmail.con", "gmail.com"),
            Map.entry("gmail.co", "gmail.com"),
            Map.entry("outlok.com", "outlook.com"),
            Map.entry("outloo.com", "outlook.com"),
            Map.entry("outlook.con", "outlook.com"),
            Map.entry("hotmal.com", "hotmail.com"),
            Map.entry("hotmail.con", "hotmail.com"),
            Map.entry("yaho.com", "yahoo.com"),
            Map.entry("yahoo.con", "yahoo.com")
    );

    private EmailAddressValidator() {
    }

    public static boolean isValid(String address) {
        return validate("recipient", address).isEmpty();
    }

    /**
     * Returns the problem with {@code address}, or empty when it is acceptable.
     *
     * @param field name reported in the problem (e.g. "recipient", "cc")
     */
    public static Optional<Problem> validate(String field, String address) {
        if (address == null || address.isBlank()) {
            return Optional.of(Problem.of(field, "Email address can't be empty."));
        }

        String email = address.trim().toLowerCase(Locale.ROOT);

        if (email.indexOf('@') < 0) {
            return Optional.of(new Problem(field, "\"" + email + "\" is missing the @ symbol.",
                    "Did you mean something like: name@domain.com?"));
        }
        if (email.contains(" ")) {
            return Optional.of(new Problem(field, "Email addresses can't contain spaces.",
                    "Maybe you meant: " + email.replace(" ", "")));
        }
        if (email.indexOf('@') != email.lastIndexOf('@')) {
            return Optional.of(new Problem(field, "\"" + email + "\" has too many @ symbols.",
                    "An email should have exactly one @ symbol."));
        }
        if (!EMAIL_PATTERN.matcher(email).matches()) {
            return Optional.of(new Problem(field, "\"" + email + "\" doesn't look like a valid email format.",
                    "Expected format: name@domain.com"));
        }

        String domain = email.substring(email.indexOf('@') + 1);
        String corrected = COMMON_DOMAIN_TYPOS.get(domain);
        if (corrected != null) {
            return Optional.of(new Problem(field, "Possible typo in \"" + domain + "\".",
                    "Did you mean: " + email.substring(0, email.indexOf('@') + 1) + corrected + "?"));
        }
        return Optional.empty();
    }

    /**
     * Partially mask an address for logs: "sarah.chen@example.com" becomes "sar***@example.com".
     */
    public static String mask(String address) {
        if (address == null || address.indexOf('@') < 0) {
            return "***";
        }
        int at = address.lastIndexOf('@');
        String local = address.substring(0, at);
        String domain = address.substring(at + 1);
        String visible = local.length() <= 3 ? local.substring(0, Math.min(1, local.length())) : local.substring(0, 3);
        return visible + "***@" + domain;
    }
}
