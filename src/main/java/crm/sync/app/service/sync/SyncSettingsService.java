package crm.sync.app.service.sync;

import crm.sync.app.dto.SyncSettingsRequest;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.entity.SyncState;
import crm.sync.app.repository.SyncStateRepository;
import crm.sync.app.service.job.SyncJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * User-facing sync settings. Any change that makes the stored cursors describe a different
 * data set than the next sync would fetch (a wider look-back window, other sources) drops
 * them, which turns the next run into a full sync.
 */
@Slf4j
@Service
public class SyncSettingsService {
    static final int MAX_LOOKBACK_DAYS = 365;

    private final SyncStateRepository syncStateRepository;
    private final SyncJobService syncJobService;

    @Value("${crm.sync.calendar.default-lookback-days:30}")
    private int calendarLookbackDays;

    @Value("${crm.sync.email.default-lookback-days:30}")
    private int emailLookbackDays;

    public SyncSettingsService(SyncStateRepository syncStateRepository, SyncJobService syncJobService) {
        this.syncStateRepository = syncStateRepository;
        this.syncJobService = syncJobService;
    }

    @Transactional
    public SyncState getOrCreate(String userId, IntegrationType type) {
        return syncStateRepository.findByUserIdAndIntegrationType(userId, type)
                .orElseGet(() -> {
                    SyncState state = new SyncState();
                    state.setUserId(userId);
                    state.setIntegrationType(type);
                    state.setLookbackDays(defaultLookbackDays(type));
                    state.setUpdatedAt(Instant.now());
                    return syncStateRepository.save(state);
                });
    }

    @Transactional
    public SyncState updateSettings(String userId, IntegrationType type, SyncSettingsRequest request) {
        SyncState state = getOrCreate(userId, type);
        boolean resetCursors = false;

        if (request.getLookbackDays() != null) {
            int requested = request.getLookbackDays();
            if (requested < 1 || requested > MAX_LOOKBACK_DAYS) {
                throw new IllegalArgumentException("lookbackDays must be between 1 and " + MAX_LOOKBACK_DAYS);
            }
            int current = state.getLookbackDays() > 0 ? state.getLookbackDays() : defaultLookbackDays(type);
            if (requested > current) {
                resetCursors = true;
            }
            state.setLookbackDays(requested);
        }

        if (request.getSelectedSourceIds() != null) {
            Set<String> sources = new LinkedHashSet<>();
            for (String sourceId : request.getSelectedSourceIds()) {
                if (sourceId != null && !sourceId.isBlank()) {
                    sources.add(sourceId.trim());
                }
            }
            if (!sources.equals(state.getSelectedSourceIds())) {
                resetCursors = true;
                state.getSelectedSourceIds().clear();
                state.getSelectedSourceIds().addAll(sources);
            }
        }

        if (request.getPrivacyMode() != null) {
            state.setPrivacyMode(request.getPrivacyMode());
        }
        if (request.getExcludedEmails() != null) {
            state.getExcludedEmails().clear();
            for (String email : request.getExcludedEmails()) {
                String normalized = normalizeEmail(email);
                if (normalized != null) {
                    state.getExcludedEmails().add(normalized);
                }
            }
        }
        if (request.getExcludedDomains() != null) {
            state.getExcludedDomains().clear();
            for (String domain : request.getExcludedDomains()) {
                String normalized = normalizeDomain(domain);
                if (normalized != null) {
                    state.getExcludedDomains().add(normalized);
                }
            }
        }

        if (request.getEnabled() != null && request.getEnabled() != state.isSyncEnabled()) {
            state.setSyncEnabled(request.getEnabled());
            if (!request.getEnabled()) {
                // Re-enabling starts over with a first full sync
                resetCursors = true;
                syncJobService.cancelPending(userId, type);
            }
        }

        if (resetCursors) {
            log.info("Clearing {} sync cursors for user {} after a settings change", type, userId);
            state.clearCursors();
        }
        state.setUpdatedAt(Instant.now());
        return syncStateRepository.save(state);
    }

    /**
     * Adds an address ({@code someone@example.com}) or a domain ({@code example.com} or
     * {@code @example.com}) to the mail exclusions.
     */
    @Transactional
    public SyncState exclude(String userId, IntegrationType type, String emailOrDomain) {
        if (type.getDomain() != SyncDomain.EMAIL) {
            throw new IllegalArgumentException("Exclusions only apply to mail integrations");
        }
        if (emailOrDomain == null || emailOrDomain.isBlank()) {
            throw new IllegalArgumentException("An email address or domain is required");
        }
        SyncState state = getOrCreate(userId, type);
        String value = emailOrDomain.trim().toLowerCase(Locale.ROOT);
        if (value.indexOf('@') > 0) {
            state.getExcludedEmails().add(value);
        } else {
            state.getExcludedDomains().add(normalizeDomain(value));
        }
        state.setUpdatedAt(Instant.now());
        return syncStateRepository.save(state);
    }

    int defaultLookbackDays(IntegrationType type) {
        return type.getDomain() == SyncDomain.CALENDAR ? calendarLookbackDays : emailLookbackDays;
    }

    private static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return null;
        }
        String normalized = domain.trim().toLowerCase(Locale.ROOT);
        while (normalized.startsWith("@")) {
            normalized = normalized.substring(1);
        }
        return normalized.isEmpty() ? null : normalized;
    }
}
