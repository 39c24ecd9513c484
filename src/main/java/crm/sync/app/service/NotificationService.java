package crm.sync.app.service;

import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.Notification;
import crm.sync.app.entity.NotificationType;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.repository.NotificationRepository;
import crm.sync.app.service.provider.ProviderOutcome;
import crm.sync.app.service.sync.SyncResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Fire-and-forget user notifications about sync runs. A failure to store a notification is
 * logged and never reaches the sync that raised it.
 */
@Slf4j
@Service
public class NotificationService {
    private final NotificationRepository notificationRepository;

    public NotificationService(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    /**
     * Only runs that stored something new are worth telling the user about.
     */
    public void syncCompleted(String userId, IntegrationType type, SyncResult result) {
        if (result.getAdded() == 0) {
            return;
        }
        String what = type.getDomain() == SyncDomain.CALENDAR ? "meetings" : "emails";
        create(userId, type, NotificationType.SYNC_COMPLETE, "Sync Complete",
                "Synced " + result.getAdded() + " new " + what + " from " + displayName(type) + ".");
    }

    public void syncFailed(String userId, IntegrationType type, ProviderOutcome outcome, boolean willRetry) {
        String cause;
        if (outcome == ProviderOutcome.AUTH_FAILED) {
            cause = "Please reconnect your " + displayName(type) + " account.";
        } else if (willRetry) {
            cause = "We'll retry automatically.";
        } else {
            cause = "Please try again later.";
        }
        create(userId, type, NotificationType.SYNC_FAILED, "Sync Failed",
                "Failed to sync " + displayName(type) + ". " + cause);
    }

    public List<Notification> list(String userId) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    private void create(String userId, IntegrationType type, NotificationType notificationType, String title, String message) {
        try {
            Notification notification = new Notification();
            notification.setUserId(userId);
            notification.setType(notificationType);
            notification.setIntegrationType(type);
            notification.setTitle(title);
            notification.setMessage(message);
            notification.setCreatedAt(Instant.now());
            notificationRepository.save(notification);
        } catch (Exception e) {
            log.error("Failed to store {} notification for user {}: {}", notificationType, userId, e.getMessage(), e);
        }
    }

    static String displayName(IntegrationType type) {
        switch (type) {
            case GOOGLE_CALENDAR:
                return "Google Calendar";
            case OUTLOOK_CALENDAR:
                return "Outlook Calendar";
            case GMAIL:
                return "Gmail";
            default:
                return "Outlook Mail";
        }
    }
}
