package crm.sync.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import crm.sync.app.dto.DisconnectResult;
import crm.sync.app.dto.IntegrationStatus;
import crm.sync.app.entity.Integration;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.OAuthProvider;
import crm.sync.app.entity.OAuthState;
import crm.sync.app.entity.OAuthToken;
import crm.sync.app.entity.SyncMode;
import crm.sync.app.entity.SyncState;
import crm.sync.app.entity.SyncStatus;
import crm.sync.app.entity.User;
import crm.sync.app.exception.IntegrationNotFoundException;
import crm.sync.app.exception.TokenVaultException;
import crm.sync.app.repository.IntegrationRepository;
import crm.sync.app.repository.InteractionRepository;
import crm.sync.app.repository.SyncStateRepository;
import crm.sync.app.repository.UserRepository;
import crm.sync.app.service.job.SyncJobScheduler;
import crm.sync.app.service.job.SyncJobService;
import crm.sync.app.service.provider.GoogleServiceFactory;
import crm.sync.app.service.provider.GraphApiClient;
import crm.sync.app.service.provider.ProviderResult;
import crm.sync.app.service.sync.SyncSettingsService;
import crm.sync.app.service.token.OAuthService;
import crm.sync.app.service.token.OAuthStateService;
import crm.sync.app.service.token.TokenEncryptionService;
import crm.sync.app.service.token.TokenGrant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Connect, callback, disconnect and status for a user's integrations.
 */
@Slf4j
@Service
public class IntegrationService {
    private final OAuthService oauthService;
    private final OAuthStateService oauthStateService;
    private final TokenEncryptionService tokenEncryptionService;
    private final UserRepository userRepository;
    private final IntegrationRepository integrationRepository;
    private final SyncStateRepository syncStateRepository;
    private final InteractionRepository interactionRepository;
    private final SyncSettingsService syncSettingsService;
    private final SyncJobScheduler syncJobScheduler;
    private final SyncJobService syncJobService;
    private final GraphApiClient graphApiClient;
    private final GoogleServiceFactory googleServiceFactory;

    public IntegrationService(OAuthService oauthService,
                              OAuthStateService oauthStateService,
                              TokenEncryptionService tokenEncryptionService,
                              UserRepository userRepository,
                              IntegrationRepository integrationRepository,
                              SyncStateRepository syncStateRepository,
                              InteractionRepository interactionRepository,
                              SyncSettingsService syncSettingsService,
                              SyncJobScheduler syncJobScheduler,
                              SyncJobService syncJobService,
                              GraphApiClient graphApiClient,
                              GoogleServiceFactory googleServiceFactory) {
        this.oauthService = oauthService;
        this.oauthStateService = oauthStateService;
        this.tokenEncryptionService = tokenEncryptionService;
        this.userRepository = userRepository;
        this.integrationRepository = integrationRepository;
        this.syncStateRepository = syncStateRepository;
        this.interactionRepository = interactionRepository;
        this.syncSettingsService = syncSettingsService;
        this.syncJobScheduler = syncJobScheduler;
        this.syncJobService = syncJobService;
        this.graphApiClient = graphApiClient;
        this.googleServiceFactory = googleServiceFactory;
    }

    /**
     * Returns the provider consent URL the user has to be sent to.
     */
    public String connect(String userId, IntegrationType type, String redirectAfter) {
        String url = oauthService.buildAuthorizationUrl(userId, type, redirectAfter);
        log.info("Starting {} connection for user {}", type, userId);
        return url;
    }

    /**
     * Completes the authorization-code flow: the state is consumed, the code exchanged, the
     * tokens stored encrypted and a first full sync queued. Returns where to send the user next.
     */
    public String handleCallback(String state, String code) {
        OAuthState oauthState = oauthStateService.consume(state);
        if (code == null || code.isEmpty()) {
            throw new IllegalArgumentException("Missing authorization code");
        }
        IntegrationType type = oauthState.getIntegrationType();
        String userId = oauthState.getUserId();

        TokenGrant grant = oauthService.exchangeCode(type, code, oauthState.getCodeVerifier());
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new IllegalStateException("User not found for OAuth state"));

        Integration integration = integrationRepository.findByUserIdAndType(userId, type).orElseGet(Integration::new);
        OAuthToken token = integration.getToken() != null ? integration.getToken() : new OAuthToken();
        token.setAccessToken(tokenEncryptionService.encrypt(grant.getAccessToken()));
        // Keep the stored refresh token when a re-consent does not hand out a new one
        if (grant.getRefreshToken() != null) {
            token.setRefreshToken(tokenEncryptionService.encrypt(grant.getRefreshToken()));
        }
        token.setExpiry(grant.getExpiresAt());
        token.setScopes(grant.getScope() != null ? grant.getScope() : type.getScopes());

        Instant now = Instant.now();
        integration.setUser(user);
        integration.setType(type);
        integration.setToken(token);
        integration.setAccountEmail(resolveAccountEmail(type, grant.getAccessToken(), user));
        integration.setActive(true);
        integration.setSyncStatus(SyncStatus.ACTIVE);
        if (integration.getConnectedAt() == null) {
            integration.setConnectedAt(now);
        }
        integration.setUpdatedAt(now);
        integrationRepository.save(integration);

        syncSettingsService.getOrCreate(userId, type);
        syncJobScheduler.queueImmediate(userId, type, SyncMode.FULL);
        log.info("Connected {} for user {}", type, userId);

        return oauthState.getRedirectAfter() != null ? oauthState.getRedirectAfter() : "/";
    }

    /**
     * Revokes the provider grant where possible and removes the integration and its sync
     * state. Interactions and contacts created by earlier syncs stay.
     */
    @Transactional
    public DisconnectResult disconnect(String userId, IntegrationType type) {
        Integration integration = integrationRepository.findByUserIdAndType(userId, type)
                .orElseThrow(() -> new IntegrationNotFoundException("No " + type.getSlug() + " integration to disconnect"));

        boolean revoked = revoke(integration);
        String warning = null;
        if (!revoked) {
            warning = integration.getType().getProvider().supportsRevocation()
                    ? "We could not revoke access at the provider. You may want to remove it from your account settings."
                    : "This provider does not support revoking access. You may want to remove it from your account settings.";
        }

        syncJobService.cancelPending(userId, type);
        syncStateRepository.deleteByUserIdAndIntegrationType(userId, type);
        integrationRepository.delete(integration);
        log.info("Disconnected {} for user {} (tokens revoked: {})", type, userId, revoked);
        return new DisconnectResult(revoked, warning);
    }

    @Transactional(readOnly = true)
    public IntegrationStatus getStatus(String userId, IntegrationType type) {
        Optional<Integration> integration = integrationRepository.findByUserIdAndType(userId, type);
        Optional<SyncState> state = syncStateRepository.findByUserIdAndIntegrationType(userId, type);
        return IntegrationStatus.builder()
                .connected(integration.map(Integration::isActive).orElse(false))
                .provider(type.getSlug())
                .accountEmail(integration.map(Integration::getAccountEmail).orElse(null))
                .syncStatus(integration.map(i -> i.getSyncStatus() != null ? i.getSyncStatus().name() : null).orElse(null))
                .totalItems(interactionRepository.countByUserIdAndExternalSource(userId, type.getExternalSource()))
                .lastSyncAt(state.map(SyncState::getLastSyncAt).orElse(null))
                .syncEnabled(state.map(SyncState::isSyncEnabled).orElse(false))
                .build();
    }

    @Transactional(readOnly = true)
    public List<IntegrationStatus> listStatuses(String userId) {
        List<IntegrationStatus> statuses = new ArrayList<>();
        for (IntegrationType type : IntegrationType.values()) {
            statuses.add(getStatus(userId, type));
        }
        return statuses;
    }

    private boolean revoke(Integration integration) {
        OAuthProvider provider = integration.getType().getProvider();
        OAuthToken token = integration.getToken();
        if (!provider.supportsRevocation() || token == null) {
            return false;
        }
        try {
            // Revoking the refresh token also invalidates access tokens issued from it
            String stored = token.getRefreshToken() != null ? token.getRefreshToken() : token.getAccessToken();
            return oauthService.revoke(provider, tokenEncryptionService.decrypt(stored));
        } catch (TokenVaultException e) {
            log.warn("Could not decrypt {} token for revocation: {}", integration.getType(), e.getMessage());
            return false;
        }
    }

    private String resolveAccountEmail(IntegrationType type, String accessToken, User user) {
        try {
            if (type.getProvider() == OAuthProvider.MICROSOFT) {
                ProviderResult<JsonNode> me = graphApiClient.get(accessToken,
                        graphApiClient.getBaseUrl() + "/me?$select=mail,userPrincipalName", "Graph profile");
                if (me.isSuccess()) {
                    JsonNode mail = me.getValue().get("mail");
                    if (mail != null && !mail.isNull()) {
                        return mail.asText();
                    }
                    JsonNode upn = me.getValue().get("userPrincipalName");
                    if (upn != null && !upn.isNull()) {
                        return upn.asText();
                    }
                }
            } else {
                switch (type) {
                    case GMAIL:
                        return googleServiceFactory.gmail(accessToken).users().getProfile("me").execute().getEmailAddress();
                    case GOOGLE_CALENDAR:
                        // The primary calendar id is the account address
                        return googleServiceFactory.calendar(accessToken).calendars().get("primary").execute().getId();
                    default:
                        break;
                }
            }
        } catch (Exception e) {
            log.warn("Could not read the {} account address, using the login address: {}", type, e.getClass().getSimpleName());
        }
        return user.getEmail();
    }
}
