package com.tlmbackup.server.service.upload;

import com.tlmbackup.server.exception.UploadException;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.internal.BackupArtifact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static com.tlmbackup.server.BackupTestUtil.settings;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DiscordUploaderTest {

    private static final String BASE_URL = "https://discord.test/api/v10";

    private static final String CHANNELS_JSON = """
            [
              {"id": "100", "name": "general", "type": 0},
              {"id": "200", "name": "database-backups", "type": 15}
            ]""";

    @TempDir
    Path backupDirectory;

    private BackupSettings backupSettings;

    private MockRestServiceServer server;

    private DiscordUploader discordUploader;

    private Path archive;

    @BeforeEach
    void setUp() throws IOException {
        this.backupSettings = settings(this.backupDirectory);
        BackupSettings.Discord discord = this.backupSettings.getUpload().getDiscord();
        discord.setBotToken("token");
        discord.setGuildId("g1");
        discord.setApiBaseUrl(BASE_URL);
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        this.server = MockRestServiceServer.bindTo(builder).build();
        this.discordUploader = new DiscordUploader(builder.build(), this.backupSettings);
        this.archive = Files.write(
                this.backupDirectory.resolve("backup_local_20260301_120000.zip"), new byte[]{1, 2, 3, 4});
    }

    private BackupArtifact artifact(long bytes, List<String> failedDatabases) {
        return BackupArtifact.builder()
                .runId("run-1")
                .jobName("nightly")
                .targetName("local")
                .databases(List.of("app", "crm"))
                .path(this.archive)
                .bytes(bytes)
                .sha256("ab12")
                .createdAt(Instant.parse("2026-03-01T12:00:00Z"))
                .durationMillis(42_000L)
                .partial(!failedDatabases.isEmpty())
                .failedDatabases(failedDatabases)
                .build();
    }

    @Test
    void existingForumChannelReceivesAttachment() {
        this.server.expect(requestTo(BASE_URL + "/guilds/g1/channels"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(CHANNELS_JSON, MediaType.APPLICATION_JSON));
        this.server.expect(requestTo(BASE_URL + "/channels/200/threads"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andExpect(content().string(containsString("backup_local_20260301_120000.zip")))
                .andRespond(withSuccess("{\"id\": \"300\", \"name\": \"Backup local\"}", MediaType.APPLICATION_JSON));

        this.discordUploader.upload(artifact(4, List.of()));

        this.server.verify();
    }

    @Test
    void missingForumChannelIsCreated() {
        this.server.expect(requestTo(BASE_URL + "/guilds/g1/channels"))
                .andRespond(withSuccess("[{\"id\": \"100\", \"name\": \"general\", \"type\": 0}]",
                        MediaType.APPLICATION_JSON));
        this.server.expect(requestTo(BASE_URL + "/guilds/g1/channels"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.name").value("database-backups"))
                .andExpect(jsonPath("$.type").value(15))
                .andRespond(withSuccess("{\"id\": \"201\", \"name\": \"database-backups\", \"type\": 15}",
                        MediaType.APPLICATION_JSON));

        assertEquals("201", this.discordUploader.getOrCreateForumChannel());
        this.server.verify();
    }

    @Test
    void oversizedArchiveIsAnnouncedWithoutAttachment() {
        this.backupSettings.getUpload().getDiscord().setMaxFileSizeBytes(2);
        this.server.expect(requestTo(BASE_URL + "/guilds/g1/channels"))
                .andRespond(withSuccess(CHANNELS_JSON, MediaType.APPLICATION_JSON));
        this.server.expect(requestTo(BASE_URL + "/channels/200/threads"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.name").value("Backup local - 2026-03-01 12:00"))
                .andExpect(jsonPath("$.message.content", containsString("File too large for Discord upload")))
                .andExpect(jsonPath("$.message.attachments").doesNotExist())
                .andRespond(withSuccess("{\"id\": \"301\"}", MediaType.APPLICATION_JSON));

        this.discordUploader.upload(artifact(4, List.of()));

        this.server.verify();
    }

    @Test
    void errorResponseBecomesUploadException() {
        this.server.expect(requestTo(BASE_URL + "/guilds/g1/channels"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\": 50001, \"message\": \"Missing Access\"}"));

        UploadException e = assertThrows(UploadException.class,
                () -> this.discordUploader.upload(artifact(4, List.of())));

        assertEquals(HttpStatus.BAD_GATEWAY, e.getStatus());
        assertTrue(e.getMessage().contains("get guild channels failed. discord responded 403"));
        assertTrue(e.getMessage().contains("Missing Access"));
    }

    @Test
    void testConnectionChecksGuildAndChannel() {
        this.server.expect(requestTo(BASE_URL + "/guilds/g1"))
                .andRespond(withSuccess("{\"id\": \"g1\", \"name\": \"Ops\"}", MediaType.APPLICATION_JSON));
        this.server.expect(requestTo(BASE_URL + "/guilds/g1/channels"))
                .andRespond(withSuccess(CHANNELS_JSON, MediaType.APPLICATION_JSON));

        this.discordUploader.testConnection();

        this.server.verify();
    }

    @Test
    void unconfiguredWithoutTokenOrGuild() {
        assertTrue(this.discordUploader.isConfigured());
        this.backupSettings.getUpload().getDiscord().setBotToken(" ");
        assertFalse(this.discordUploader.isConfigured());
    }

    @Test
    void messageContentListsPartialFailure() {
        String content = DiscordUploader.buildMessageContent(artifact(2 * 1024 * 1024, List.of("erp")));

        assertTrue(content.startsWith("**Database Backup Completed**"));
        assertTrue(content.contains("**Databases (2):** `app, crm`"));
        assertTrue(content.contains("**Timestamp:** 2026-03-01 12:00:00 UTC"));
        assertTrue(content.contains("**File Size:** 2.00 MB"));
        assertTrue(content.contains("**Duration:** 42 seconds"));
        assertTrue(content.contains("**Status:** Partial (failed: erp)"));
    }
}
