package com.filelink.api.controller;

import com.filelink.api.dto.ApiResponse;
import com.filelink.api.dto.BlockRequest;
import com.filelink.api.dto.BroadcastRequest;
import com.filelink.api.dto.BulkDeleteRequest;
import com.filelink.api.dto.FileView;
import com.filelink.api.dto.SettingUpdateRequest;
import com.filelink.api.dto.SubscriptionGrantRequest;
import com.filelink.api.dto.UserView;
import com.filelink.api.service.AdminModerationService;
import com.filelink.api.service.BroadcastReport;
import com.filelink.api.service.FileRegistry;
import com.filelink.api.service.LinkIssuer;
import com.filelink.api.settings.SettingKey;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admin panel API. Every call here has passed the bearer token check.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final int MAX_PAGE_SIZE = 100;

    private final AdminModerationService moderationService;
    private final LinkIssuer linkIssuer;

    public AdminController(AdminModerationService moderationService, LinkIssuer linkIssuer) {
        this.moderationService = moderationService;
        this.linkIssuer = linkIssuer;
    }

    // ---- Users ----

    @GetMapping("/users")
    public ResponseEntity<ApiResponse> searchUsers(@RequestParam(value = "search", defaultValue = "") String search,
                                                   @RequestParam(value = "page", defaultValue = "0") int page,
                                                   @RequestParam(value = "size", defaultValue = "20") int size) {
        Page<UserView> users = moderationService.searchUsers(search, pageOf(page, size)).map(UserView::from);
        return ResponseEntity.ok(ApiResponse.ok(users.getTotalElements() + " user(s)", pageBody(users)));
    }

    @PostMapping("/users/{id}/block")
    public ResponseEntity<ApiResponse> blockUser(@PathVariable long id,
                                                 @Valid @RequestBody(required = false) BlockRequest body) {
        Duration duration = body != null && body.getDurationHours() != null
                ? Duration.ofHours(body.getDurationHours())
                : null;
        boolean changed = moderationService.blockUser(id, body != null ? body.getReason() : null, duration);
        return ResponseEntity.ok(ApiResponse.ok(changed ? "User blocked" : "User was already blocked", changed));
    }

    @PostMapping("/users/{id}/unblock")
    public ResponseEntity<ApiResponse> unblockUser(@PathVariable long id) {
        boolean changed = moderationService.unblockUser(id);
        return ResponseEntity.ok(ApiResponse.ok(changed ? "User unblocked" : "User was not blocked", changed));
    }

    @PutMapping("/users/{id}/subscription")
    public ResponseEntity<ApiResponse> grantSubscription(@PathVariable long id,
                                                         @Valid @RequestBody SubscriptionGrantRequest body) {
        UserView user = UserView.from(moderationService.grantSubscription(id, body.getTier(), body.getExpiry()));
        return ResponseEntity.ok(ApiResponse.ok("Subscription granted", user));
    }

    // ---- Files and links ----

    @GetMapping("/files")
    public ResponseEntity<ApiResponse> searchFiles(@RequestParam(value = "search", defaultValue = "") String search,
                                                   @RequestParam(value = "page", defaultValue = "0") int page,
                                                   @RequestParam(value = "size", defaultValue = "20") int size) {
        Page<FileView> files = moderationService.searchFiles(search, pageOf(page, size)).map(f -> FileView.from(f, null));
        return ResponseEntity.ok(ApiResponse.ok(files.getTotalElements() + " file(s)", pageBody(files)));
    }

    @DeleteMapping("/files/{id}")
    public ResponseEntity<ApiResponse> deleteFile(@PathVariable String id) {
        FileRegistry.DeleteOutcome outcome = moderationService.deleteFile(id);
        return ResponseEntity.ok(ApiResponse.ok(
                outcome == FileRegistry.DeleteOutcome.DELETED ? "File deleted" : "File was already deleted",
                outcome));
    }

    @PostMapping("/files/delete-bulk")
    public ResponseEntity<ApiResponse> deleteFiles(@Valid @RequestBody BulkDeleteRequest body) {
        int deleted = moderationService.deleteFiles(body.getFileIds());
        return ResponseEntity.ok(ApiResponse.ok(deleted + " file(s) deleted", Map.of("deleted", deleted)));
    }

    @PostMapping("/files/{id}/regenerate")
    public ResponseEntity<ApiResponse> regenerateLink(@PathVariable String id) {
        String token = moderationService.regenerateLink(id);
        return ResponseEntity.ok(ApiResponse.ok("New link issued", linkIssuer.downloadUrl(token)));
    }

    // Diagnostic view: tells expired, deleted and unknown links apart
    @GetMapping("/links/{token}")
    public ResponseEntity<ApiResponse> inspectLink(@PathVariable String token) {
        LinkIssuer.LinkDiagnosis diagnosis = moderationService.inspectLink(token);
        return ResponseEntity.ok(ApiResponse.ok(diagnosis.getStatus().name(), diagnosis));
    }

    // ---- Background downloads ----

    @PostMapping("/tasks/cancel-all")
    public ResponseEntity<ApiResponse> cancelAllTasks() {
        int cancelled = moderationService.cancelAllTasks();
        return ResponseEntity.ok(ApiResponse.ok(cancelled + " download(s) cancelled", Map.of("cancelled", cancelled)));
    }

    // ---- Settings ----

    @GetMapping("/settings")
    public ResponseEntity<ApiResponse> listSettings() {
        return ResponseEntity.ok(ApiResponse.ok("Settings", moderationService.listSettings()));
    }

    @PutMapping("/settings/{name}")
    public ResponseEntity<ApiResponse> updateSetting(@PathVariable String name,
                                                     @Valid @RequestBody SettingUpdateRequest body) {
        SettingKey key = moderationService.updateSetting(name, body.getValue());
        String message = key.isRestartRequired() ? key + " saved, takes effect after restart" : key + " updated";
        return ResponseEntity.ok(ApiResponse.ok(message, key.name()));
    }

    // ---- Bot ----

    @PostMapping("/bot/pause")
    public ResponseEntity<ApiResponse> pause() {
        boolean changed = moderationService.pauseBot();
        return ResponseEntity.ok(ApiResponse.ok(changed ? "Bot paused" : "Bot was already paused", status()));
    }

    @PostMapping("/bot/resume")
    public ResponseEntity<ApiResponse> resume() {
        boolean changed = moderationService.resumeBot();
        return ResponseEntity.ok(ApiResponse.ok(changed ? "Bot resumed" : "Bot was not paused", status()));
    }

    @GetMapping("/bot/status")
    public ResponseEntity<ApiResponse> botStatus() {
        return ResponseEntity.ok(ApiResponse.ok("Bot status", status()));
    }

    @PostMapping("/broadcast")
    public ResponseEntity<ApiResponse> broadcast(@Valid @RequestBody BroadcastRequest body) {
        BroadcastReport report = moderationService.broadcast(body.getMessage());
        return ResponseEntity.ok(ApiResponse.ok(
                "Delivered to " + report.getDelivered() + " of " + report.getRecipients(), report));
    }

    private Map<String, Object> status() {
        return Map.of("paused", moderationService.isPaused());
    }

    private static PageRequest pageOf(int page, int size) {
        return PageRequest.of(Math.max(page, 0), Math.max(1, Math.min(size, MAX_PAGE_SIZE)));
    }

    private static Map<String, Object> pageBody(Page<?> page) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", page.getContent());
        body.put("page", page.getNumber());
        body.put("size", page.getSize());
        body.put("totalElements", page.getTotalElements());
        body.put("totalPages", page.getTotalPages());
        return body;
    }
}
