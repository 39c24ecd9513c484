package crm.sync.app.service.token;

import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.OAuthState;
import crm.sync.app.exception.InvalidOAuthStateException;
import crm.sync.app.repository.OAuthStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Persisted CSRF state for the OAuth authorization step. A state value is bound to the user
 * who started the flow, lives for 10 minutes and can be consumed once.
 */
@Slf4j
@Service
public class OAuthStateService {
    static final Duration STATE_TTL = Duration.ofMinutes(10);

    private final OAuthStateRepository oauthStateRepository;
    private final SecureRandom secureRandom = new SecureRandom();

    public OAuthStateService(OAuthStateRepository oauthStateRepository) {
        this.oauthStateRepository = oauthStateRepository;
    }

    @Transactional
    public OAuthState create(String userId, IntegrationType type, String redirectAfter) {
        Instant now = Instant.now();
        OAuthState state = new OAuthState();
        state.setState(randomUrlSafe(32));
        state.setUserId(userId);
        state.setIntegrationType(type);
        state.setCodeVerifier(randomUrlSafe(32));
        state.setRedirectAfter(redirectAfter);
        state.setCreatedAt(now);
        state.setExpiresAt(now.plus(STATE_TTL));
        return oauthStateRepository.save(state);
    }

    /**
     * Removes the state and returns what it was bound to.
     *
     * @throws InvalidOAuthStateException if the state is unknown, already used or expired
     */
    @Transactional(noRollbackFor = InvalidOAuthStateException.class)
    public OAuthState consume(String stateValue) {
        if (stateValue == null || stateValue.isEmpty()) {
            throw new InvalidOAuthStateException("Missing OAuth state");
        }
        OAuthState state = oauthStateRepository.findById(stateValue)
                .orElseThrow(() -> new InvalidOAuthStateException("Unknown or already used OAuth state"));

        // A concurrent callback may have deleted it between the read and here
        if (oauthStateRepository.deleteByStateValue(stateValue) == 0) {
            throw new InvalidOAuthStateException("Unknown or already used OAuth state");
        }
        if (state.isExpired(Instant.now())) {
            throw new InvalidOAuthStateException("OAuth state has expired, please start the connection again");
        }
        return state;
    }

    @Scheduled(fixedRate = 3600000)
    @Transactional
    public void purgeExpired() {
        int deleted = oauthStateRepository.deleteExpired(Instant.now());
        if (deleted > 0) {
            log.debug("Purged {} expired OAuth states", deleted);
        }
    }

    private String randomUrlSafe(int bytes) {
        byte[] buffer = new byte[bytes];
        secureRandom.nextBytes(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer);
    }
}
