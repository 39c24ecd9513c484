package crm.sync.app.controller;

import crm.sync.app.dto.DisconnectResult;
import crm.sync.app.dto.IntegrationStatus;
import crm.sync.app.dto.MeetingNotesRequest;
import crm.sync.app.dto.MeetingView;
import crm.sync.app.dto.SyncSettingsRequest;
import crm.sync.app.dto.SyncSettingsView;
import crm.sync.app.dto.SyncTriggerResponse;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.entity.SyncJob;
import crm.sync.app.service.CalendarSyncService;
import crm.sync.app.service.EmailSyncService;
import crm.sync.app.service.EventRange;
import crm.sync.app.service.IntegrationService;
import crm.sync.app.service.UserService;
import crm.sync.app.service.matching.AttendeeAggregate;
import crm.sync.app.service.matching.CalendarContactImporterService;
import crm.sync.app.service.matching.ImportOptions;
import crm.sync.app.service.matching.ImportResult;
import crm.sync.app.service.provider.CalendarInfo;
import crm.sync.app.service.sync.SyncSettingsService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Integration endpoints. {@code type} is a slug such as {@code calendar-google}.
 */
@RestController
@RequestMapping("/api/integrations")
public class IntegrationController {
    private final UserService userService;
    private final IntegrationService integrationService;
    private final SyncSettingsService syncSettingsService;
    private final CalendarSyncService calendarSyncService;
    private final EmailSyncService emailSyncService;
    private final CalendarContactImporterService calendarContactImporterService;

    public IntegrationController(UserService userService,
                                 IntegrationService integrationService,
                                 SyncSettingsService syncSettingsService,
                                 CalendarSyncService calendarSyncService,
                                 EmailSyncService emailSyncService,
                                 CalendarContactImporterService calendarContactImporterService) {
        this.userService = userService;
        this.integrationService = integrationService;
        this.syncSettingsService = syncSettingsService;
        this.calendarSyncService = calendarSyncService;
        this.emailSyncService = emailSyncService;
        this.calendarContactImporterService = calendarContactImporterService;
    }

    @GetMapping
    public List<IntegrationStatus> list(Authentication authentication) {
        return integrationService.listStatuses(userService.currentUserId(authentication));
    }

    @GetMapping("/{type}/connect")
    public Map<String, String> connect(@PathVariable String type,
                                       @RequestParam(required = false) String redirect,
                                       Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        String url = integrationService.connect(userId, IntegrationType.fromValue(type), safeRedirect(redirect));
        return Map.of("authUrl", url);
    }

    // The integration type travels in the state, so one registered redirect URI serves every type
    @GetMapping({"/callback", "/{type}/callback"})
    public ResponseEntity<Void> callback(@RequestParam(required = false) String state,
                                         @RequestParam(required = false) String code,
                                         @RequestParam(required = false) String error) {
        if (error != null) {
            throw new IllegalArgumentException("Authorization was not granted: " + error);
        }
        String location = integrationService.handleCallback(state, code);
        return ResponseEntity.status(HttpStatus.FOUND).header(HttpHeaders.LOCATION, location).build();
    }

    @PostMapping("/{type}/sync")
    public ResponseEntity<SyncTriggerResponse> sync(@PathVariable String type,
                                                    @RequestParam(defaultValue = "false") boolean full,
                                                    Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        IntegrationType integrationType = IntegrationType.fromValue(type);
        SyncJob job = integrationType.getDomain() == SyncDomain.CALENDAR
                ? calendarSyncService.triggerSync(userId, integrationType, full)
                : emailSyncService.triggerSync(userId, integrationType, full);
        return ResponseEntity.accepted().body(SyncTriggerResponse.from(job));
    }

    @DeleteMapping("/{type}")
    public DisconnectResult disconnect(@PathVariable String type, Authentication authentication) {
        return integrationService.disconnect(userService.currentUserId(authentication), IntegrationType.fromValue(type));
    }

    @GetMapping("/{type}/status")
    public IntegrationStatus status(@PathVariable String type, Authentication authentication) {
        return integrationService.getStatus(userService.currentUserId(authentication), IntegrationType.fromValue(type));
    }

    @PutMapping("/{type}/settings")
    public SyncSettingsView updateSettings(@PathVariable String type,
                                           @RequestBody SyncSettingsRequest request,
                                           Authentication authentication) {
        return SyncSettingsView.from(syncSettingsService.updateSettings(
                userService.currentUserId(authentication), IntegrationType.fromValue(type), request));
    }

    @PostMapping("/{type}/exclusions")
    public SyncSettingsView exclude(@PathVariable String type,
                                    @RequestParam String value,
                                    Authentication authentication) {
        return SyncSettingsView.from(emailSyncService.excludeAddress(
                userService.currentUserId(authentication), IntegrationType.fromValue(type), value));
    }

    @GetMapping("/{type}/calendars")
    public List<CalendarInfo> calendars(@PathVariable String type, Authentication authentication) {
        return calendarSyncService.listCalendars(userService.currentUserId(authentication), IntegrationType.fromValue(type));
    }

    // Meetings from every connected calendar
    @GetMapping("/{type}/events")
    public List<MeetingView> events(@PathVariable String type,
                                    @RequestParam(defaultValue = "upcoming") String range,
                                    @RequestParam(defaultValue = "30") int days,
                                    Authentication authentication) {
        EventRange eventRange = EventRange.valueOf(range.trim().toUpperCase(Locale.ROOT));
        return calendarSyncService.fetchEvents(userService.currentUserId(authentication), eventRange, days);
    }

    @PutMapping("/{type}/events/{interactionId}/notes")
    public MeetingView addNotes(@PathVariable String type,
                                @PathVariable String interactionId,
                                @RequestBody MeetingNotesRequest request,
                                Authentication authentication) {
        return calendarSyncService.addMeetingNotes(userService.currentUserId(authentication),
                interactionId, request.getNotes(), request.isAppend());
    }

    @GetMapping("/{type}/import/preview")
    public List<AttendeeAggregate> previewImport(@PathVariable String type,
                                                 @RequestParam(defaultValue = "90") int days,
                                                 Authentication authentication) {
        return calendarContactImporterService.previewImport(userService.currentUserId(authentication),
                IntegrationType.fromValue(type), days);
    }

    @PostMapping("/{type}/import")
    public ImportResult importContacts(@PathVariable String type,
                                       @RequestBody ImportOptions options,
                                       Authentication authentication) {
        return calendarContactImporterService.importContacts(userService.currentUserId(authentication),
                IntegrationType.fromValue(type), options);
    }

    // Only same-site relative paths, never another host
    static String safeRedirect(String redirect) {
        if (redirect == null || !redirect.startsWith("/") || redirect.startsWith("//") || redirect.contains("\\")) {
            return null;
        }
        return redirect;
    }
}
