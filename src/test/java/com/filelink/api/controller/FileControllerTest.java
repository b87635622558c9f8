package com.filelink.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filelink.api.client.RemoteFileFetcher;
import com.filelink.api.service.FetchTaskService;
import com.filelink.api.service.Requester;
import com.filelink.api.support.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.time.Duration;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FileControllerTest extends IntegrationTest {

    private static final String USER = "X-User-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private FetchTaskService fetchTaskService;

    private JsonNode uploadVia(long userId, String name, byte[] content) throws Exception {
        String body = mockMvc.perform(multipart("/api/files/upload")
                        .file(new MockMultipartFile("file", name, MediaType.TEXT_PLAIN_VALUE, content))
                        .param("expiryDays", "3")
                        .header(USER, userId)
                        .header("X-Username", "alice"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("data");
    }

    @Test
    void uploadAnswersWithTheDownloadUrl() throws Exception {
        long userId = newUserId();

        mockMvc.perform(multipart("/api/files/upload")
                        .file(new MockMultipartFile("file", "notes.txt", MediaType.TEXT_PLAIN_VALUE, randomBytes(300)))
                        .param("expiryDays", "3")
                        .header(USER, userId))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("CREATED"))
                .andExpect(jsonPath("$.data.fileName").value("notes.txt"))
                .andExpect(jsonPath("$.data.size").value(300))
                .andExpect(jsonPath("$.data.downloadUrl", startsWith("https://files.test/d/")));
    }

    @Test
    void requestsWithoutUserAreRejected() throws Exception {
        mockMvc.perform(multipart("/api/files/upload")
                        .file(new MockMultipartFile("file", "notes.txt", MediaType.TEXT_PLAIN_VALUE, randomBytes(3))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("BAD_REQUEST"));
    }

    @Test
    void deniedUploadsCarryTheReason() throws Exception {
        long userId = newUserId();

        mockMvc.perform(multipart("/api/files/upload")
                        .file(new MockMultipartFile("file", "setup.exe", "application/octet-stream", randomBytes(3)))
                        .header(USER, userId))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.status").value("EXTENSION_BLOCKED"))
                .andExpect(jsonPath("$.data.messageKey").value("denial.extension-blocked"));

        mockMvc.perform(multipart("/api/files/upload")
                        .file(new MockMultipartFile("file", "a.txt", MediaType.TEXT_PLAIN_VALUE, randomBytes(3)))
                        .param("expiryDays", "90")
                        .header(USER, userId))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listsDeletesAndRegeneratesOwnFiles() throws Exception {
        long userId = newUserId();
        JsonNode older = uploadVia(userId, "older.txt", randomBytes(10));
        clock.advance(Duration.ofSeconds(5));
        JsonNode newer = uploadVia(userId, "newer.txt", randomBytes(10));

        mockMvc.perform(get("/api/files").header(USER, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].fileName").value("newer.txt"))
                .andExpect(jsonPath("$.data[0].downloadUrl").value(newer.get("downloadUrl").asText()))
                .andExpect(jsonPath("$.data[1].fileName").value("older.txt"));

        mockMvc.perform(get("/api/files").param("search", "OLD").header(USER, userId))
                .andExpect(jsonPath("$.data", hasSize(1)));

        String olderId = older.get("fileId").asText();
        mockMvc.perform(delete("/api/files/{id}", olderId).header(USER, newUserId()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value("OWNER_MISMATCH"));
        mockMvc.perform(delete("/api/files/{id}", olderId).header(USER, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("DELETED"));
        mockMvc.perform(delete("/api/files/{id}", olderId).header(USER, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("ALREADY_DELETED"));
        mockMvc.perform(delete("/api/files/{id}", "no-such-file").header(USER, userId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("NOT_FOUND"));

        String oldUrl = newer.get("downloadUrl").asText();
        String newUrl = objectMapper.readTree(mockMvc.perform(
                        post("/api/files/{id}/regenerate", newer.get("fileId").asText()).header(USER, userId))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString()).get("data").asText();

        mockMvc.perform(get(URI.create(oldUrl).getPath())).andExpect(status().isNotFound());
        mockMvc.perform(get(URI.create(newUrl).getPath())).andExpect(status().isOk());
    }

    @Test
    void accountOverviewShowsTrialAndUsage() throws Exception {
        long userId = newUserId();
        uploadVia(userId, "a.txt", randomBytes(1000));

        mockMvc.perform(get("/api/files/me").header(USER, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(userId))
                .andExpect(jsonPath("$.data.username").value("alice"))
                .andExpect(jsonPath("$.data.tier").value("TRIAL"))
                .andExpect(jsonPath("$.data.onTrial").value(true))
                .andExpect(jsonPath("$.data.filesStored").value(1))
                .andExpect(jsonPath("$.data.bytesStored").value(1000))
                .andExpect(jsonPath("$.data.quota.maxFiles").value(10));
    }

    @Test
    void registersFilesFromUrls() throws Exception {
        long userId = newUserId();
        byte[] content = randomBytes(700);
        doAnswer(invocation -> {
            RemoteFileFetcher.ContentHandler<?> handler = invocation.getArgument(1);
            return handler.handle(new ByteArrayInputStream(content), content.length, "image/png");
        }).when(remoteFileFetcher).fetch(any(URI.class), any());

        mockMvc.perform(post("/api/files/upload-link")
                        .header(USER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://cdn.example.com/img/cat.png\", \"expiryDays\": 2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.fileName").value("cat.png"))
                .andExpect(jsonPath("$.data.size").value(700));

        mockMvc.perform(post("/api/files/upload-link")
                        .header(USER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"http://192.168.1.1/router.cfg\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("INVALID_URL"));

        mockMvc.perform(post("/api/files/upload-link")
                        .header(USER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("BAD_REQUEST"));
    }

    @Test
    void urlDownloadsCanRunInTheBackground() throws Exception {
        long userId = newUserId();
        byte[] content = randomBytes(50);
        doAnswer(invocation -> {
            RemoteFileFetcher.ContentHandler<?> handler = invocation.getArgument(1);
            return handler.handle(new ByteArrayInputStream(content), content.length, "text/plain");
        }).when(remoteFileFetcher).fetch(any(URI.class), any());

        String body = mockMvc.perform(post("/api/files/tasks")
                        .header(USER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://cdn.example.com/notes.txt\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("ACCEPTED"))
                .andExpect(jsonPath("$.data.url").value("https://cdn.example.com/notes.txt"))
                .andReturn().getResponse().getContentAsString();
        String taskId = objectMapper.readTree(body).get("data").get("taskId").asText();

        // Polled on the service, the endpoint itself is rate limited
        for (int i = 0; i < 500 && !fetchTaskService.get(taskId, Requester.panel()).getStatus().isFinished(); i++) {
            Thread.sleep(20);
        }
        mockMvc.perform(get("/api/files/tasks/{id}", taskId).header(USER, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("COMPLETED"))
                .andExpect(jsonPath("$.data.fileId").isString());

        mockMvc.perform(get("/api/files/tasks").header(USER, userId))
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].downloadUrl", startsWith("https://files.test/d/")));
        mockMvc.perform(get("/api/files/tasks/{id}", taskId).header(USER, newUserId()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value("OWNER_MISMATCH"));
        mockMvc.perform(post("/api/files/tasks/{id}/cancel", taskId).header(USER, userId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("TASK_FINISHED"));
        mockMvc.perform(post("/api/files/tasks/{id}/cancel", "no-such-task").header(USER, userId))
                .andExpect(status().isNotFound());
    }

    @Test
    void bulkDeleteRemovesOnlyOwnFiles() throws Exception {
        long userId = newUserId();
        long otherId = newUserId();
        String first = uploadVia(userId, "one.txt", randomBytes(10)).get("fileId").asText();
        String second = uploadVia(userId, "two.txt", randomBytes(10)).get("fileId").asText();
        String foreign = uploadVia(otherId, "theirs.txt", randomBytes(10)).get("fileId").asText();

        mockMvc.perform(post("/api/files/delete-bulk")
                        .header(USER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileIds\": [\"" + first + "\", \"" + second + "\", \"" + foreign + "\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deleted").value(2));

        mockMvc.perform(get("/api/files").header(USER, userId))
                .andExpect(jsonPath("$.data", hasSize(0)));
        mockMvc.perform(get("/api/files").header(USER, otherId))
                .andExpect(jsonPath("$.data", hasSize(1)));
        mockMvc.perform(post("/api/files/delete-bulk")
                        .header(USER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileIds\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void chattyUsersAreThrottled() throws Exception {
        long userId = newUserId();
        for (int i = 0; i < 30; i++) {
            mockMvc.perform(get("/api/files").header(USER, userId)).andExpect(status().isOk());
        }

        mockMvc.perform(get("/api/files").header(USER, userId))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "60"))
                .andExpect(jsonPath("$.status").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.data.retryAfterSeconds").value(60));
    }
}
