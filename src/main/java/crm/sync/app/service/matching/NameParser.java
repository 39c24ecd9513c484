package crm.sync.app.service.matching;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Splits attendee display names, or failing that email local parts, into first and last name.
 * Never throws; unusable input gives "Unknown".
 */
public final class NameParser {
    static final String UNKNOWN = "Unknown";

    private NameParser() {
    }

    public static ParsedName parse(String displayName, String email) {
        if (displayName != null && !displayName.isBlank()) {
            String trimmed = displayName.trim();
            // Some providers put the address in the name field
            if (trimmed.contains("@")) {
                return fromEmail(trimmed);
            }
            String[] tokens = trimmed.split("\\s+");
            String lastName = tokens.length > 1 ? String.join(" ", Arrays.copyOfRange(tokens, 1, tokens.length)) : null;
            return new ParsedName(tokens[0], lastName);
        }
        return fromEmail(email);
    }

    static ParsedName fromEmail(String email) {
        if (email == null || email.isBlank()) {
            return new ParsedName(UNKNOWN, null);
        }
        String localPart = email.trim();
        int at = localPart.indexOf('@');
        if (at >= 0) {
            localPart = localPart.substring(0, at);
        }
        int plus = localPart.indexOf('+');
        if (plus >= 0) {
            localPart = localPart.substring(0, plus);
        }

        List<String> parts = new ArrayList<>();
        for (String part : localPart.split("[._-]+")) {
            if (!part.isEmpty()) {
                parts.add(capitalize(part));
            }
        }
        if (parts.isEmpty()) {
            return new ParsedName(UNKNOWN, null);
        }
        String lastName = parts.size() > 1 ? parts.stream().skip(1).collect(Collectors.joining(" ")) : null;
        return new ParsedName(parts.get(0), lastName);
    }

    static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1).toLowerCase(Locale.ROOT);
    }
}
