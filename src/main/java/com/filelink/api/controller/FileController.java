package com.filelink.api.controller;

import com.filelink.api.dto.ApiResponse;
import com.filelink.api.dto.BulkDeleteRequest;
import com.filelink.api.dto.FileView;
import com.filelink.api.dto.RegistrationResponse;
import com.filelink.api.dto.UrlRegistrationRequest;
import com.filelink.api.dto.UserView;
import com.filelink.api.model.FileRecord;
import com.filelink.api.model.UserAccount;
import com.filelink.api.service.CommandGuard;
import com.filelink.api.service.FetchTaskService;
import com.filelink.api.service.FileRegistrationService;
import com.filelink.api.service.FileRegistry;
import com.filelink.api.service.LinkIssuer;
import com.filelink.api.service.Registration;
import com.filelink.api.service.RegistrationRequest;
import com.filelink.api.service.Requester;
import com.filelink.api.service.SubscriptionGate;
import com.filelink.api.service.TaskSnapshot;
import com.filelink.api.service.UserRegistry;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Endpoints the chat bot calls on behalf of a user. The bot authenticates the user and
 * passes the chat id in {@code X-User-Id}.
 */
@RestController
@RequestMapping("/api/files")
public class FileController {

    static final String USER_HEADER = "X-User-Id";
    static final String USERNAME_HEADER = "X-Username";
    static final String DISPLAY_NAME_HEADER = "X-Display-Name";
    private static final int MAX_LIST = 200;

    private final CommandGuard commandGuard;
    private final FileRegistrationService registrationService;
    private final FileRegistry fileRegistry;
    private final LinkIssuer linkIssuer;
    private final UserRegistry userRegistry;
    private final SubscriptionGate subscriptionGate;
    private final FetchTaskService fetchTaskService;
    private final Clock clock;

    public FileController(CommandGuard commandGuard,
                          FileRegistrationService registrationService,
                          FileRegistry fileRegistry,
                          LinkIssuer linkIssuer,
                          UserRegistry userRegistry,
                          SubscriptionGate subscriptionGate,
                          FetchTaskService fetchTaskService,
                          Clock clock) {
        this.commandGuard = commandGuard;
        this.registrationService = registrationService;
        this.fileRegistry = fileRegistry;
        this.linkIssuer = linkIssuer;
        this.userRegistry = userRegistry;
        this.subscriptionGate = subscriptionGate;
        this.fetchTaskService = fetchTaskService;
        this.clock = clock;
    }

    // 1. Upload
    // POST /api/files/upload  form-data: file, expiryDays (optional)
    @PostMapping("/upload")
    public ResponseEntity<ApiResponse> uploadFile(
            @RequestHeader(USER_HEADER) long userId,
            @RequestHeader(value = USERNAME_HEADER, required = false) String username,
            @RequestHeader(value = DISPLAY_NAME_HEADER, required = false) String displayName,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "expiryDays", required = false) Integer expiryDays) throws IOException {

        commandGuard.admit(userId);
        RegistrationRequest request = RegistrationRequest.builder()
                .ownerId(userId)
                .username(username)
                .displayName(displayName)
                .fileName(file.getOriginalFilename())
                .contentType(file.getContentType())
                .declaredSize(file.getSize())
                .expiryDays(expiryDays)
                .build();

        Registration registration;
        try (InputStream content = file.getInputStream()) {
            registration = registrationService.registerUpload(request, content);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.created("File registered", RegistrationResponse.from(registration)));
    }

    // 2. Register from a URL
    // POST /api/files/upload-link  {"url": "...", "fileName": "...", "expiryDays": 7}
    @PostMapping("/upload-link")
    public ResponseEntity<ApiResponse> uploadFromUrl(
            @RequestHeader(USER_HEADER) long userId,
            @RequestHeader(value = USERNAME_HEADER, required = false) String username,
            @RequestHeader(value = DISPLAY_NAME_HEADER, required = false) String displayName,
            @Valid @RequestBody UrlRegistrationRequest body) {

        commandGuard.admit(userId);
        RegistrationRequest request = RegistrationRequest.builder()
                .ownerId(userId)
                .username(username)
                .displayName(displayName)
                .fileName(body.getFileName())
                .expiryDays(body.getExpiryDays())
                .build();

        Registration registration = registrationService.registerFromUrl(request, body.getUrl());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.created("File registered", RegistrationResponse.from(registration)));
    }

    // 2b. Same as upload-link, but answers at once and downloads in the background
    // POST /api/files/tasks  {"url": "...", "fileName": "...", "expiryDays": 7}
    @PostMapping("/tasks")
    public ResponseEntity<ApiResponse> submitTask(
            @RequestHeader(USER_HEADER) long userId,
            @RequestHeader(value = USERNAME_HEADER, required = false) String username,
            @RequestHeader(value = DISPLAY_NAME_HEADER, required = false) String displayName,
            @Valid @RequestBody UrlRegistrationRequest body) {

        commandGuard.admit(userId);
        RegistrationRequest request = RegistrationRequest.builder()
                .ownerId(userId)
                .username(username)
                .displayName(displayName)
                .fileName(body.getFileName())
                .expiryDays(body.getExpiryDays())
                .build();

        TaskSnapshot task = fetchTaskService.submit(request, body.getUrl());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.accepted("Download queued", task));
    }

    @GetMapping("/tasks")
    public ResponseEntity<ApiResponse> listTasks(@RequestHeader(USER_HEADER) long userId) {
        commandGuard.admit(userId);
        List<TaskSnapshot> tasks = fetchTaskService.listByOwner(userId);
        return ResponseEntity.ok(ApiResponse.ok(tasks.size() + " task(s)", tasks));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<ApiResponse> taskStatus(@RequestHeader(USER_HEADER) long userId, @PathVariable String taskId) {
        Requester requester = commandGuard.admit(userId);
        TaskSnapshot task = fetchTaskService.get(taskId, requester);
        return ResponseEntity.ok(ApiResponse.ok(task.getStatus().name(), task));
    }

    @PostMapping("/tasks/{taskId}/cancel")
    public ResponseEntity<ApiResponse> cancelTask(@RequestHeader(USER_HEADER) long userId, @PathVariable String taskId) {
        Requester requester = commandGuard.admit(userId);
        TaskSnapshot task = fetchTaskService.cancel(taskId, requester);
        return ResponseEntity.ok(ApiResponse.ok("Download cancelled", task));
    }

    // 3. My files, newest first
    @GetMapping
    public ResponseEntity<ApiResponse> listFiles(
            @RequestHeader(USER_HEADER) long userId,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {

        commandGuard.admit(userId);
        List<FileView> files;
        try (Stream<FileRecord> stream = fileRegistry.listByOwner(userId, search)) {
            files = stream
                    .limit(Math.max(1, Math.min(limit, MAX_LIST)))
                    .map(f -> FileView.from(f, f.getDownloadToken() != null ? linkIssuer.downloadUrl(f.getDownloadToken()) : null))
                    .collect(Collectors.toList());
        }
        return ResponseEntity.ok(ApiResponse.ok(files.size() + " file(s)", files));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse> deleteFile(@RequestHeader(USER_HEADER) long userId, @PathVariable String id) {
        Requester requester = commandGuard.admit(userId);
        FileRegistry.DeleteOutcome outcome = fileRegistry.softDelete(id, requester);
        return ResponseEntity.ok(ApiResponse.ok(
                outcome == FileRegistry.DeleteOutcome.DELETED ? "File deleted" : "File was already deleted",
                outcome));
    }

    // POST /api/files/delete-bulk  {"fileIds": ["...", "..."]}
    @PostMapping("/delete-bulk")
    public ResponseEntity<ApiResponse> deleteFiles(@RequestHeader(USER_HEADER) long userId,
                                                   @Valid @RequestBody BulkDeleteRequest body) {
        Requester requester = commandGuard.admit(userId);
        int deleted = fileRegistry.softDeleteAll(body.getFileIds(), requester);
        return ResponseEntity.ok(ApiResponse.ok(deleted + " file(s) deleted", Map.of("deleted", deleted)));
    }

    @PostMapping("/{id}/regenerate")
    public ResponseEntity<ApiResponse> regenerateLink(@RequestHeader(USER_HEADER) long userId, @PathVariable String id) {
        Requester requester = commandGuard.admit(userId);
        String token = linkIssuer.regenerate(id, requester);
        return ResponseEntity.ok(ApiResponse.ok("New link issued, the previous one no longer works",
                linkIssuer.downloadUrl(token)));
    }

    // Subscription and quota overview
    @GetMapping("/me")
    public ResponseEntity<ApiResponse> me(
            @RequestHeader(USER_HEADER) long userId,
            @RequestHeader(value = USERNAME_HEADER, required = false) String username,
            @RequestHeader(value = DISPLAY_NAME_HEADER, required = false) String displayName) {

        commandGuard.admit(userId);
        UserAccount user = userRegistry.getOrCreate(userId, username, displayName);
        boolean onTrial = subscriptionGate.isTrialActive(user, LocalDateTime.now(clock)) && !user.getTier().isPaid();
        UserView view = UserView.from(user).toBuilder()
                .onTrial(onTrial)
                .trialEndsAt(subscriptionGate.trialEndsAt(user))
                .filesStored(fileRegistry.countLiveFiles(userId))
                .bytesStored(fileRegistry.usedBytes(userId))
                .quota(subscriptionGate.effectiveQuota(user))
                .build();
        return ResponseEntity.ok(ApiResponse.ok("Account", view));
    }
}
