package crm.sync.app.service;

import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.entity.SyncJob;
import crm.sync.app.entity.SyncMode;
import crm.sync.app.entity.SyncState;
import crm.sync.app.exception.IntegrationNotFoundException;
import crm.sync.app.repository.IntegrationRepository;
import crm.sync.app.service.job.SyncJobScheduler;
import crm.sync.app.service.sync.SyncSettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class EmailSyncService {
    private final IntegrationRepository integrationRepository;
    private final SyncJobScheduler syncJobScheduler;
    private final SyncSettingsService syncSettingsService;

    public EmailSyncService(IntegrationRepository integrationRepository,
                            SyncJobScheduler syncJobScheduler,
                            SyncSettingsService syncSettingsService) {
        this.integrationRepository = integrationRepository;
        this.syncJobScheduler = syncJobScheduler;
        this.syncSettingsService = syncSettingsService;
    }

    public SyncJob triggerSync(String userId, IntegrationType type, boolean full) {
        requireMail(type);
        if (integrationRepository.findActiveByUserIdAndType(userId, type).isEmpty()) {
            throw new IntegrationNotFoundException("No active " + type.getSlug() + " integration");
        }
        return syncJobScheduler.queueImmediate(userId, type, full ? SyncMode.FULL : SyncMode.INCREMENTAL);
    }

    /**
     * Stops future syncs from storing mail exchanged with an address or a whole domain.
     * Mail already stored is kept.
     */
    public SyncState excludeAddress(String userId, IntegrationType type, String emailOrDomain) {
        requireMail(type);
        SyncState state = syncSettingsService.exclude(userId, type, emailOrDomain);
        log.info("Added a mail exclusion for user {} on {}", userId, type);
        return state;
    }

    private static void requireMail(IntegrationType type) {
        if (type.getDomain() != SyncDomain.EMAIL) {
            throw new IllegalArgumentException(type.getSlug() + " is not a mail integration");
        }
    }
}
