package io.meetflow.demo.server;

import io.meetflow.spi.AccessTokenProvider;
import io.meetflow.spi.DraftGenerationTrigger;
import io.meetflow.spi.TranscriptSource;
import io.meetflow.spring.boot.MeetflowProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Application-side collaborators the starter expects: where transcripts come from and what
 * happens once one is stored.
 */
@Configuration
public class PipelineConfiguration {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    RestTemplate transcriptRestTemplate(RestTemplateBuilder builder, MeetflowProperties props) {
        Duration timeout = props.getTranscript().getRequestTimeout();
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .build();
    }

    // OAuth and token storage live outside this sample; Zoom URLs carry their own download token
    @Bean
    AccessTokenProvider accessTokenProvider() {
        return AccessTokenProvider.NONE;
    }

    @Bean
    TranscriptSource transcriptSource(RestTemplate transcriptRestTemplate,
            AccessTokenProvider accessTokenProvider,
            MeetflowServerProperties props) {
        return new HttpTranscriptSource(transcriptRestTemplate, accessTokenProvider,
            props.getMeetApiBaseUrl(), props.getGraphApiBaseUrl());
    }

    @Bean
    DraftGenerationTrigger draftGenerationTrigger() {
        return meetingId -> log.info("[Draft] Generation requested for meeting {}", meetingId);
    }
}
