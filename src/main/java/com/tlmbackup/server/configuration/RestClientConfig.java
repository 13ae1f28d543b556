package com.tlmbackup.server.configuration;

import com.tlmbackup.server.model.config.BackupSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClient discordRestClient(BackupSettings backupSettings) {
        BackupSettings.Discord discord = backupSettings.getUpload().getDiscord();
        return RestClient.builder()
                .baseUrl(discord.getApiBaseUrl())
                .defaultHeaders(headers -> {
                    headers.set(HttpHeaders.USER_AGENT, "TLM-SQL-Backup/1.0");
                    if (discord.isConfigured()) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Bot " + discord.getBotToken());
                    }
                })
                .build();
    }
}
