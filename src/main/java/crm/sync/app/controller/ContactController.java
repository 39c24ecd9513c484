package crm.sync.app.controller;

import crm.sync.app.dto.MergeRequest;
import crm.sync.app.entity.Contact;
import crm.sync.app.service.UserService;
import crm.sync.app.service.matching.DeduplicationService;
import crm.sync.app.service.matching.DuplicateMatch;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/contacts")
public class ContactController {
    private final UserService userService;
    private final DeduplicationService deduplicationService;

    public ContactController(UserService userService, DeduplicationService deduplicationService) {
        this.userService = userService;
        this.deduplicationService = deduplicationService;
    }

    @GetMapping("/duplicates")
    public List<DuplicateMatch> duplicates(Authentication authentication) {
        return deduplicationService.batchFindDuplicates(userService.currentUserId(authentication));
    }

    @PostMapping("/{id}/merge")
    public Contact merge(@PathVariable String id, @RequestBody MergeRequest request, Authentication authentication) {
        return deduplicationService.mergeContacts(userService.currentUserId(authentication), id, request.getDuplicateIds());
    }
}
