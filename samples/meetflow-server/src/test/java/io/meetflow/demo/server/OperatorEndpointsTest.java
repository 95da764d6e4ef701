package io.meetflow.demo.server;

import io.meetflow.Meetflow;
import io.meetflow.dead.DeadLetterManager;
import io.meetflow.model.DeadLetter;
import io.meetflow.spi.TranscriptSource;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives a meeting into the dead-letter store and back out through the operator endpoints.
 * The worker is ticked by hand.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:meetflow_operator;DB_CLOSE_DELAY=-1",
    "meetflow.worker.enabled=false",
    "meetflow.retry.max-attempts=1"
})
@AutoConfigureMockMvc
class OperatorEndpointsTest {
    private static final String VTT = String.join("\n",
        "WEBVTT",
        "",
        "00:00:01.000 --> 00:00:04.000",
        "Alice: Hello everyone",
        "",
        "00:00:05.000 --> 00:00:07.000",
        "<v Bob>Thanks Alice</v>",
        "");

    @Autowired
    MockMvc mvc;

    @Autowired
    Meetflow meetflow;

    @Autowired
    DeadLetterManager deadLetters;

    @MockBean
    TranscriptSource transcriptSource;

    @Test
    void failedDownloadIsDeadLetteredAndReplayed() throws Exception {
        doThrow(new IOException("HTTP 404 fetching transcript")).when(transcriptSource).fetch(any(), any());

        mvc.perform(post("/webhooks/zoom").contentType(MediaType.APPLICATION_JSON)
                .content(WebhookControllerTest.zoomTranscriptCompleted(UUID.randomUUID().toString())))
            .andExpect(status().isAccepted());
        meetflow.worker().tick();

        List<DeadLetter> unresolved = deadLetters.listUnresolved();
        assertEquals(1, unresolved.size());
        DeadLetter deadLetter = unresolved.get(0);
        String meetingId = deadLetter.referenceId();

        mvc.perform(get("/dead-letters"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.unresolved").value(1))
            .andExpect(jsonPath("$.deadLetters[0].id").value(deadLetter.id()))
            .andExpect(jsonPath("$.deadLetters[0].step").value("transcript_fetch"))
            .andExpect(jsonPath("$.deadLetters[0].platform").value("zoom"))
            .andExpect(jsonPath("$.deadLetters[0].alertSent").value(true));

        mvc.perform(get("/meetings/{id}/status", meetingId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.estimatedRemainingMs").value(0));

        mvc.perform(get("/webhook-failures/metrics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.queueDepth").value(0))
            .andExpect(jsonPath("$.totals.dead_letter").value(1))
            .andExpect(jsonPath("$.byPlatform.zoom.dead_letter").value(1));

        doReturn(VTT).when(transcriptSource).fetch(any(), any());
        mvc.perform(post("/dead-letters/{id}/replay", deadLetter.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notes\":\"Recording restored\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.replayed").value(true));
        meetflow.worker().tick();

        mvc.perform(get("/meetings/{id}/status", meetingId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ready"))
            .andExpect(jsonPath("$.progress").value(100));
        assertEquals("Recording restored", deadLetters.find(deadLetter.id()).orElseThrow().resolutionNotes());

        mvc.perform(post("/dead-letters/{id}/replay", deadLetter.id()))
            .andExpect(status().isConflict());
        mvc.perform(post("/meetings/{id}/restart", meetingId))
            .andExpect(status().isConflict());
    }

    @Test
    void unknownIdsAreNotFound() throws Exception {
        mvc.perform(get("/meetings/{id}/status", "missing"))
            .andExpect(status().isNotFound());
        mvc.perform(post("/meetings/{id}/restart", "missing"))
            .andExpect(status().isNotFound());
        mvc.perform(post("/dead-letters/{id}/resolve", "missing")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notes\":\"n/a\"}"))
            .andExpect(status().isNotFound());
    }
}
