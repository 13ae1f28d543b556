package com.tlmbackup.server.service.upload;

import com.tlmbackup.server.exception.UploadException;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.discord.*;
import com.tlmbackup.server.model.internal.BackupArtifact;
import com.tlmbackup.server.util.FilesystemUtil;
import com.tlmbackup.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Posts every backup as a new thread in a Discord forum channel, creating the channel on
 * first use. Archives up to {@code maxFileSizeBytes} are attached; larger ones are announced
 * with their local path only.
 */
@Slf4j
@Service
public class DiscordUploader implements BackupUploader {

    private static final DateTimeFormatter TITLE_TIME = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter MESSAGE_TIME = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final RestClient restClient;

    private final BackupSettings.Discord discordSettings;

    @Autowired
    public DiscordUploader(
            @Qualifier("discordRestClient") RestClient restClient,
            BackupSettings backupSettings) {
        this.restClient = restClient;
        this.discordSettings = backupSettings.getUpload().getDiscord();
    }

    @Override
    public String getName() {
        return "Discord Forum";
    }

    @Override
    public boolean isConfigured() {
        return this.discordSettings.isConfigured();
    }

    @Override
    public void upload(BackupArtifact artifact) throws UploadException {
        if (artifact == null || artifact.getPath() == null) {
            throw new UploadException("discord upload failed. artifact or path is null");
        }
        log.info("discord upload. job is {}, archive is {}", artifact.getJobName(), artifact.getPath());
        String channelId = this.getOrCreateForumChannel();
        CreatedThread createdThread = this.createForumPost(channelId, artifact);
        log.info("discord upload done. thread id is {}", createdThread == null ? null : createdThread.getId());
    }

    @Override
    public void testConnection() throws UploadException {
        DiscordGuild discordGuild = this.get(
                "/guilds/{guildId}",
                new ParameterizedTypeReference<DiscordGuild>() {},
                this.discordSettings.getGuildId()
        ).getOrThrow("verify guild access");
        log.info("discord testConnection. verified access to guild {} ({})", discordGuild.getName(), discordGuild.getId());
        this.getOrCreateForumChannel();
    }

    String getOrCreateForumChannel() throws UploadException {
        List<DiscordChannel> channels = this.get(
                "/guilds/{guildId}/channels",
                new ParameterizedTypeReference<List<DiscordChannel>>() {},
                this.discordSettings.getGuildId()
        ).getOrThrow("get guild channels");
        if (CollectionUtils.isNotEmpty(channels)) {
            for (DiscordChannel channel : channels) {
                if (channel.isForum() && this.discordSettings.getForumChannelName().equals(channel.getName())) {
                    return channel.getId();
                }
            }
        }
        log.info("getOrCreateForumChannel. creating forum channel {}", this.discordSettings.getForumChannelName());
        DiscordChannel created = this.handleClientResponse(
                this.restClient.post()
                        .uri("/guilds/{guildId}/channels", this.discordSettings.getGuildId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(new CreateForumChannelRequest(this.discordSettings.getForumChannelName())),
                new ParameterizedTypeReference<DiscordChannel>() {}
        ).getOrThrow("create forum channel");
        if (ObjectUtils.isEmpty(created) || StringUtils.isBlank(created.getId())) {
            throw new UploadException("create forum channel failed. response has no channel id");
        }
        return created.getId();
    }

    private CreatedThread createForumPost(String channelId, BackupArtifact artifact) throws UploadException {
        String title = "Backup %s - %s".formatted(artifact.getTargetName(), TITLE_TIME.format(artifact.getCreatedAt()));
        String content = buildMessageContent(artifact);
        // 超过大小限制, 只发消息不带附件
        if (artifact.getBytes() > this.discordSettings.getMaxFileSizeBytes()) {
            log.warn("createForumPost. archive size {} exceeds limit {}, posting without attachment",
                    FilesystemUtil.formatMegabytes(artifact.getBytes()),
                    FilesystemUtil.formatMegabytes(this.discordSettings.getMaxFileSizeBytes()));
            String tooLarge = content + "\n\n**Note:** File too large for Discord upload. Backup saved locally at: `%s`"
                    .formatted(artifact.getPath());
            return this.handleClientResponse(
                    this.restClient.post()
                            .uri("/channels/{channelId}/threads", channelId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body(new CreateForumPostRequest(title, new DiscordMessage(tooLarge))),
                    new ParameterizedTypeReference<CreatedThread>() {}
            ).getOrThrow("create forum post");
        }
        String fileName = artifact.getPath().getFileName().toString();
        CreateForumPostRequest payload = new CreateForumPostRequest(
                title,
                new DiscordMessage(content, List.of(new DiscordAttachment(0, fileName))));
        // multipart: payload_json + files[0]
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        HttpHeaders payloadHeaders = new HttpHeaders();
        payloadHeaders.setContentType(MediaType.APPLICATION_JSON);
        parts.add("payload_json", new HttpEntity<>(JsonUtil.serializeToString(payload), payloadHeaders));
        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentType(MediaType.parseMediaType("application/zip"));
        parts.add("files[0]", new HttpEntity<>(new FileSystemResource(artifact.getPath()), fileHeaders));
        return this.handleClientResponse(
                this.restClient.post()
                        .uri("/channels/{channelId}/threads", channelId)
                        .contentType(MediaType.MULTIPART_FORM_DATA)
                        .body(parts),
                new ParameterizedTypeReference<CreatedThread>() {}
        ).getOrThrow("create forum post with attachment");
    }

    static String buildMessageContent(BackupArtifact artifact) {
        String status = artifact.isPartial() ?
                "Partial (failed: %s)".formatted(String.join(", ", artifact.getFailedDatabases())) :
                "Success";
        return """
                **Database Backup Completed**

                **Connection:** `%s`
                **Databases (%d):** `%s`
                **Timestamp:** %s
                **File Size:** %.2f MB
                **Duration:** %d seconds
                **SHA256:** `%s`
                **Status:** %s""".formatted(
                artifact.getTargetName(),
                artifact.getDatabases().size(),
                String.join(", ", artifact.getDatabases()),
                MESSAGE_TIME.format(artifact.getCreatedAt()),
                FilesystemUtil.toMegabytes(artifact.getBytes()),
                artifact.getDurationMillis() / 1000,
                StringUtils.defaultIfBlank(artifact.getSha256(), "N/A"),
                status);
    }

    private <T> DiscordResponse<T> get(String uri, ParameterizedTypeReference<T> dataType, Object... uriVariables) {
        return this.handleClientResponse(this.restClient.get().uri(uri, uriVariables), dataType);
    }

    private <T> DiscordResponse<T> handleClientResponse(
            RestClient.RequestHeadersSpec<?> requestSpec,
            ParameterizedTypeReference<T> dataType) {
        try {
            return requestSpec.exchange((httpRequest, httpResponse) -> {
                HttpStatusCode statusCode = httpResponse.getStatusCode();
                if (statusCode.is2xxSuccessful()) {
                    return DiscordResponse.success(statusCode.value(), httpResponse.bodyTo(dataType));
                }
                // 处理错误http响应（非2xx）, body 不一定是 json
                DiscordErrorInfo errorInfo;
                try {
                    errorInfo = httpResponse.bodyTo(DiscordErrorInfo.class);
                } catch (Exception e) {
                    errorInfo = new DiscordErrorInfo();
                    errorInfo.setMessage(e.getMessage());
                }
                if (errorInfo == null) {
                    errorInfo = new DiscordErrorInfo();
                }
                return DiscordResponse.error(statusCode.value(), errorInfo);
            });
        } catch (Exception e) {
            // 处理其他异常
            return DiscordResponse.error(e);
        }
    }
}
