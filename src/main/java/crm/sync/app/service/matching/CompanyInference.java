package crm.sync.app.service.matching;

import java.util.Locale;
import java.util.Set;

/**
 * Guesses a company name from an email domain, skipping public webmail providers.
 */
public final class CompanyInference {
    static final Set<String> WEBMAIL_DOMAINS = Set.of(
            "gmail.com", "googlemail.com", "yahoo.com", "outlook.com", "hotmail.com", "live.com",
            "icloud.com", "me.com", "mail.com", "protonmail.com", "proton.me", "aol.com", "msn.com");

    private CompanyInference() {
    }

    public static String infer(String email) {
        if (email == null) {
            return null;
        }
        int at = email.lastIndexOf('@');
        if (at < 0 || at == email.length() - 1) {
            return null;
        }
        String domain = email.substring(at + 1).trim().toLowerCase(Locale.ROOT);
        if (domain.isEmpty() || WEBMAIL_DOMAINS.contains(domain)) {
            return null;
        }
        String label = domain.split("\\.")[0];
        return label.isEmpty() ? null : NameParser.capitalize(label);
    }
}
