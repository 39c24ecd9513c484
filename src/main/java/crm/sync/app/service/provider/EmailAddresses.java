package crm.sync.app.service.provider;

import crm.sync.app.entity.ParticipantRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses RFC 5322 style address headers such as {@code "Doe, Jane" <jane@co.com>, bob@co.com}.
 */
public final class EmailAddresses {
    private static final Pattern NAME_ADDR = Pattern.compile("^\\s*\"?([^\"<]*?)\"?\\s*<([^>]+)>\\s*$");

    private EmailAddresses() {
    }

    public static List<Participant> parseList(String header, ParticipantRole role) {
        List<Participant> participants = new ArrayList<>();
        if (header == null || header.isBlank()) {
            return participants;
        }
        for (String part : splitAddresses(header)) {
            Participant participant = parse(part, role);
            if (participant != null) {
                participants.add(participant);
            }
        }
        return participants;
    }

    public static Participant parse(String value, ParticipantRole role) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String name = null;
        String email;
        Matcher matcher = NAME_ADDR.matcher(value);
        if (matcher.matches()) {
            name = matcher.group(1).trim();
            email = matcher.group(2).trim();
        } else {
            email = value.trim();
        }
        if (!email.contains("@")) {
            return null;
        }
        return Participant.builder()
                .email(email.toLowerCase(Locale.ROOT))
                .displayName(name == null || name.isEmpty() ? null : name)
                .role(role)
                .build();
    }

    // Commas inside quoted display names do not separate addresses
    private static List<String> splitAddresses(String header) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean inAngle = false;
        for (char c : header.toCharArray()) {
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '<') {
                inAngle = true;
            } else if (c == '>') {
                inAngle = false;
            }
            if (c == ',' && !quoted && !inAngle) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }
}
