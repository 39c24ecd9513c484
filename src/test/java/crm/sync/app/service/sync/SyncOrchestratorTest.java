package crm.sync.app.service.sync;

import crm.sync.app.entity.Integration;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.OAuthProvider;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.entity.SyncMode;
import crm.sync.app.entity.SyncState;
import crm.sync.app.entity.User;
import crm.sync.app.exception.OAuthClientRejectedException;
import crm.sync.app.exception.ReconnectRequiredException;
import crm.sync.app.repository.IntegrationRepository;
import crm.sync.app.repository.SyncStateRepository;
import crm.sync.app.service.provider.ExternalItem;
import crm.sync.app.service.provider.FetchWindow;
import crm.sync.app.service.provider.ProviderClient;
import crm.sync.app.service.provider.ProviderOutcome;
import crm.sync.app.service.provider.ProviderPage;
import crm.sync.app.service.provider.ProviderRegistry;
import crm.sync.app.service.provider.ProviderResult;
import crm.sync.app.service.token.TokenRefreshService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncOrchestratorTest {

    private static final String USER_ID = "user123";

    @Mock
    private IntegrationRepository integrationRepository;

    @Mock
    private SyncStateRepository syncStateRepository;

    @Mock
    private ProviderRegistry providerRegistry;

    @Mock
    private TokenRefreshService tokenRefreshService;

    @Mock
    private ProviderClient providerClient;

    @Mock
    private SyncItemHandler calendarHandler;

    private SyncOrchestrator syncOrchestrator;
    private Integration integration;
    private SyncState state;

    @BeforeEach
    void setUp() {
        when(calendarHandler.getDomain()).thenReturn(SyncDomain.CALENDAR);
        syncOrchestrator = new SyncOrchestrator(integrationRepository, syncStateRepository, providerRegistry,
                new ProviderCallTemplate(tokenRefreshService), List.of(calendarHandler));
        ReflectionTestUtils.setField(syncOrchestrator, "calendarLookbackDays", 30);
        ReflectionTestUtils.setField(syncOrchestrator, "calendarFutureDays", 90);
        ReflectionTestUtils.setField(syncOrchestrator, "emailLookbackDays", 30);

        User user = new User();
        user.setId(USER_ID);
        user.setEmail("me@example.com");

        integration = new Integration();
        integration.setId("integration123");
        integration.setUser(user);
        integration.setType(IntegrationType.GOOGLE_CALENDAR);
        integration.setActive(true);

        state = new SyncState();
        state.setUserId(USER_ID);
        state.setIntegrationType(IntegrationType.GOOGLE_CALENDAR);
        state.setLookbackDays(30);

        when(integrationRepository.findActiveByUserIdAndType(USER_ID, IntegrationType.GOOGLE_CALENDAR))
                .thenReturn(Optional.of(integration));
        when(syncStateRepository.findByUserIdAndIntegrationType(USER_ID, IntegrationType.GOOGLE_CALENDAR))
                .thenReturn(Optional.of(state));
        when(syncStateRepository.save(any(SyncState.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(providerRegistry.get(IntegrationType.GOOGLE_CALENDAR)).thenReturn(providerClient);
        when(providerClient.defaultSourceId()).thenReturn("primary");
        when(tokenRefreshService.ensureValidAccessToken(integration)).thenReturn("token");
    }

    private static ExternalItem item(String id) {
        return ExternalItem.builder()
                .externalId(id)
                .sourceId("primary")
                .startsAt(Instant.now().minus(Duration.ofDays(1)))
                .build();
    }

    private static ProviderResult<ProviderPage> page(List<ExternalItem> items, String nextPageToken, String cursor) {
        return ProviderResult.success(new ProviderPage(items, nextPageToken, cursor));
    }

    @Test
    void sync_WithExpiredCursor_ShouldFallBackToFullSyncAndStoreFreshCursor() {
        // Given
        state.putCursor("primary", "stale-cursor");
        when(providerClient.fetchIncremental("token", "primary", "stale-cursor", null))
                .thenReturn(ProviderResult.failure(ProviderOutcome.CURSOR_EXPIRED, 410, "Gone"));
        when(providerClient.fetchFull(eq("token"), eq("primary"), any(FetchWindow.class), isNull()))
                .thenReturn(page(List.of(item("e1")), "page-2", null));
        when(providerClient.fetchFull(eq("token"), eq("primary"), any(FetchWindow.class), eq("page-2")))
                .thenReturn(page(List.of(item("e2")), null, "fresh-cursor"));
        when(calendarHandler.handle(any(SyncContext.class), any(ExternalItem.class))).thenReturn(ItemOutcome.ADDED);

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(2, result.getAdded());
        assertEquals(2, result.getSynced());
        assertEquals("fresh-cursor", result.getCursors().get("primary"));
        assertEquals("fresh-cursor", state.getCursor("primary"));
        assertNotNull(state.getLastSyncAt());
        verify(syncStateRepository).save(state);
    }

    @Test
    void sync_WithValidCursor_ShouldOnlyFetchIncrementally() {
        // Given
        state.putCursor("primary", "cursor-1");
        when(providerClient.fetchIncremental("token", "primary", "cursor-1", null))
                .thenReturn(page(List.of(item("e1")), null, "cursor-2"));
        when(calendarHandler.handle(any(SyncContext.class), any(ExternalItem.class))).thenReturn(ItemOutcome.UPDATED);

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertEquals(1, result.getUpdated());
        assertEquals("cursor-2", state.getCursor("primary"));
        verify(providerClient, never()).fetchFull(anyString(), anyString(), any(), any());
    }

    @Test
    void sync_WhenUserDisablesSyncDuringRun_ShouldKeepItDisabledAndStoreNoCursor() {
        // Given
        state.setId("state-1");
        state.putCursor("primary", "cursor-1");
        SyncState disabledMidRun = copyOf(state);
        disabledMidRun.setSyncEnabled(false);
        disabledMidRun.clearCursors();
        when(syncStateRepository.findByUserIdAndIntegrationType(USER_ID, IntegrationType.GOOGLE_CALENDAR))
                .thenReturn(Optional.of(state), Optional.of(disabledMidRun));
        when(providerClient.fetchIncremental("token", "primary", "cursor-1", null))
                .thenReturn(page(List.of(item("e1")), null, "cursor-2"));
        when(calendarHandler.handle(any(SyncContext.class), any(ExternalItem.class))).thenReturn(ItemOutcome.ADDED);

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertTrue(result.isSuccess());
        assertFalse(disabledMidRun.isSyncEnabled());
        assertNull(disabledMidRun.getCursor("primary"));
        assertNull(disabledMidRun.getLastSyncAt());
        verify(syncStateRepository, never()).save(any());
    }

    @Test
    void sync_WhenLookbackWidenedDuringRun_ShouldLeaveCursorsClearedForFullResync() {
        // Given
        state.setId("state-1");
        state.putCursor("primary", "cursor-1");
        SyncState widenedMidRun = copyOf(state);
        widenedMidRun.setLookbackDays(180);
        widenedMidRun.clearCursors();
        when(syncStateRepository.findByUserIdAndIntegrationType(USER_ID, IntegrationType.GOOGLE_CALENDAR))
                .thenReturn(Optional.of(state), Optional.of(widenedMidRun));
        when(providerClient.fetchIncremental("token", "primary", "cursor-1", null))
                .thenReturn(page(List.of(), null, "cursor-2"));

        // When
        syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertTrue(widenedMidRun.getCursors().isEmpty());
        assertEquals(180, widenedMidRun.getLookbackDays());
        verify(syncStateRepository, never()).save(any());
    }

    @Test
    void sync_WhenSettingsUnchanged_ShouldWriteCursorOntoFreshCopy() {
        // Given
        state.setId("state-1");
        state.putCursor("primary", "cursor-1");
        SyncState reloaded = copyOf(state);
        when(syncStateRepository.findByUserIdAndIntegrationType(USER_ID, IntegrationType.GOOGLE_CALENDAR))
                .thenReturn(Optional.of(state), Optional.of(reloaded));
        when(providerClient.fetchIncremental("token", "primary", "cursor-1", null))
                .thenReturn(page(List.of(), null, "cursor-2"));

        // When
        syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertEquals("cursor-2", reloaded.getCursor("primary"));
        assertNotNull(reloaded.getLastSyncAt());
        verify(syncStateRepository).save(reloaded);
        verify(syncStateRepository, never()).save(state);
    }

    @Test
    void sync_WhenStateSavedConcurrently_ShouldDropCursorsWithoutFailingTheRun() {
        // Given
        state.setId("state-1");
        when(providerClient.fetchFull(eq("token"), eq("primary"), any(FetchWindow.class), isNull()))
                .thenReturn(page(List.of(), null, "cursor-new"));
        when(syncStateRepository.save(any(SyncState.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(SyncState.class, "state-1"));

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.FULL, null);

        // Then
        assertTrue(result.isSuccess());
    }

    @Test
    void sync_WhenStateRemovedDuringRun_ShouldNotRecreateIt() {
        // Given
        state.setId("state-1");
        when(syncStateRepository.findByUserIdAndIntegrationType(USER_ID, IntegrationType.GOOGLE_CALENDAR))
                .thenReturn(Optional.of(state), Optional.empty());
        when(providerClient.fetchFull(eq("token"), eq("primary"), any(FetchWindow.class), isNull()))
                .thenReturn(page(List.of(), null, "cursor-new"));

        // When
        syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.FULL, null);

        // Then
        verify(syncStateRepository, never()).save(any());
    }

    private static SyncState copyOf(SyncState source) {
        SyncState copy = new SyncState();
        copy.setId(source.getId());
        copy.setUserId(source.getUserId());
        copy.setIntegrationType(source.getIntegrationType());
        copy.setLookbackDays(source.getLookbackDays());
        copy.setSyncEnabled(source.isSyncEnabled());
        copy.getSelectedSourceIds().addAll(source.getSelectedSourceIds());
        copy.getCursors().putAll(source.getCursors());
        return copy;
    }

    @Test
    void sync_InFullMode_ShouldIgnoreStoredCursor() {
        // Given
        state.putCursor("primary", "cursor-1");
        when(providerClient.fetchFull(eq("token"), eq("primary"), any(FetchWindow.class), isNull()))
                .thenReturn(page(List.of(), null, "cursor-new"));

        // When
        syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.FULL, null);

        // Then
        verify(providerClient, never()).fetchIncremental(anyString(), anyString(), anyString(), any());
        assertEquals("cursor-new", state.getCursor("primary"));
    }

    @Test
    void sync_WhenOneItemFails_ShouldCountItAsSkippedAndContinue() {
        // Given
        ExternalItem first = item("e1");
        ExternalItem broken = item("e2");
        ExternalItem third = item("e3");
        when(providerClient.fetchFull(eq("token"), eq("primary"), any(FetchWindow.class), isNull()))
                .thenReturn(page(List.of(first, broken, third), null, "cursor"));
        when(calendarHandler.handle(any(SyncContext.class), eq(first))).thenReturn(ItemOutcome.ADDED);
        when(calendarHandler.handle(any(SyncContext.class), eq(broken))).thenThrow(new RuntimeException("constraint violation"));
        when(calendarHandler.handle(any(SyncContext.class), eq(third))).thenReturn(ItemOutcome.ADDED);

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.FULL, null);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(2, result.getAdded());
        assertEquals(1, result.getSkipped());
        verify(calendarHandler, times(3)).handle(any(SyncContext.class), any(ExternalItem.class));
    }

    @Test
    void sync_WithRevokedGrant_ShouldReportAuthFailed() {
        // Given
        when(tokenRefreshService.ensureValidAccessToken(integration))
                .thenThrow(new ReconnectRequiredException(IntegrationType.GOOGLE_CALENDAR, "revoked"));

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertEquals(ProviderOutcome.AUTH_FAILED, result.getOutcome());
        assertTrue(result.getMessage().contains("reconnect"));
        assertNull(state.getLastSyncAt());
    }

    @Test
    void sync_WithRejectedClientCredentials_ShouldFailWithoutAskingForReconnect() {
        // Given
        when(tokenRefreshService.ensureValidAccessToken(integration))
                .thenThrow(new OAuthClientRejectedException(OAuthProvider.GOOGLE));

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertEquals(ProviderOutcome.TERMINAL, result.getOutcome());
        assertFalse(result.getMessage().contains("reconnect"));
        assertNull(state.getLastSyncAt());
    }

    @Test
    void sync_With401_ShouldRefreshOnceAndRetry() {
        // Given
        when(tokenRefreshService.refreshTokenOn401(integration)).thenReturn("token-2");
        when(providerClient.fetchFull(eq("token"), eq("primary"), any(FetchWindow.class), isNull()))
                .thenReturn(ProviderResult.failure(ProviderOutcome.AUTH_FAILED, 401, "Unauthorized"));
        when(providerClient.fetchFull(eq("token-2"), eq("primary"), any(FetchWindow.class), isNull()))
                .thenReturn(page(List.of(), null, "cursor"));

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.FULL, null);

        // Then
        assertTrue(result.isSuccess());
        verify(tokenRefreshService, times(1)).refreshTokenOn401(integration);
    }

    @Test
    void sync_WithRateLimit_ShouldReportRetryableAndKeepCursor() {
        // Given
        state.putCursor("primary", "cursor-1");
        when(providerClient.fetchIncremental("token", "primary", "cursor-1", null))
                .thenReturn(ProviderResult.failure(ProviderOutcome.RETRYABLE, 429, "Rate limited", Duration.ofSeconds(90)));

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertEquals(ProviderOutcome.RETRYABLE, result.getOutcome());
        assertEquals(Duration.ofSeconds(90), result.getRetryAfter());
        assertEquals("cursor-1", state.getCursor("primary"));
        verify(calendarHandler, never()).handle(any(), any());
    }

    @Test
    void sync_WhenDisabled_ShouldNotCallProvider() {
        // Given
        state.setSyncEnabled(false);

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(0, result.getSynced());
        verifyNoInteractions(providerClient);
    }

    @Test
    void sync_WithoutActiveIntegration_ShouldFailTerminally() {
        // Given
        when(integrationRepository.findActiveByUserIdAndType(USER_ID, IntegrationType.GOOGLE_CALENDAR))
                .thenReturn(Optional.empty());

        // When
        SyncResult result = syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.INCREMENTAL, null);

        // Then
        assertEquals(ProviderOutcome.TERMINAL, result.getOutcome());
        verify(syncStateRepository, never()).save(any());
    }

    @Test
    void sync_WithSelectedSources_ShouldKeepCursorPerSource() {
        // Given
        state.getSelectedSourceIds().add("work");
        state.getSelectedSourceIds().add("family");
        when(providerClient.fetchFull(eq("token"), eq("work"), any(FetchWindow.class), isNull()))
                .thenReturn(page(List.of(), null, "work-cursor"));
        when(providerClient.fetchFull(eq("token"), eq("family"), any(FetchWindow.class), isNull()))
                .thenReturn(page(List.of(), null, "family-cursor"));

        // When
        syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.FULL, null);

        // Then
        assertEquals("work-cursor", state.getCursor("work"));
        assertEquals("family-cursor", state.getCursor("family"));
    }

    @Test
    void sync_ShouldReportNonDecreasingProgressEndingAt100() {
        // Given
        List<ExternalItem> items = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            items.add(item("e" + i));
        }
        when(providerClient.fetchFull(eq("token"), eq("primary"), any(FetchWindow.class), isNull()))
                .thenReturn(page(items, null, "cursor"));
        when(calendarHandler.handle(any(SyncContext.class), any(ExternalItem.class))).thenReturn(ItemOutcome.ADDED);
        List<Integer> reported = new ArrayList<>();

        // When
        syncOrchestrator.sync(USER_ID, IntegrationType.GOOGLE_CALENDAR, SyncMode.FULL, reported::add);

        // Then
        assertFalse(reported.isEmpty());
        for (int i = 1; i < reported.size(); i++) {
            assertTrue(reported.get(i) >= reported.get(i - 1));
        }
        assertEquals(100, reported.get(reported.size() - 1));
    }

    @Test
    void windowFor_ShouldCoverFutureForCalendarsOnly() {
        // Given
        Instant now = Instant.parse("2024-06-01T00:00:00Z");
        state.setLookbackDays(10);

        // When
        FetchWindow calendar = syncOrchestrator.windowFor(IntegrationType.OUTLOOK_CALENDAR, state, now);
        FetchWindow email = syncOrchestrator.windowFor(IntegrationType.GMAIL, state, now);

        // Then
        assertEquals(now.minus(Duration.ofDays(10)), calendar.getTimeMin());
        assertEquals(now.plus(Duration.ofDays(90)), calendar.getTimeMax());
        assertEquals(now, email.getTimeMax());
    }
}
