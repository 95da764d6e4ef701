package io.meetflow.demo.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.meetflow.ingest.EventIngestor;
import io.meetflow.ingest.IngestResult;
import io.meetflow.ingest.platform.ZoomEventAdapter;
import io.meetflow.model.Platform;
import io.meetflow.util.JsonCodec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Receives platform webhooks. Ingestion is synchronous and cheap; all processing happens on
 * the worker, so the response only reflects whether the delivery was new.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private static final Map<String, Platform> PLATFORMS = Map.of(
        "zoom", Platform.ZOOM,
        "google-meet", Platform.GOOGLE_MEET,
        "teams", Platform.MICROSOFT_TEAMS);

    private final EventIngestor ingestor;
    private final MeetflowServerProperties props;
    private final JsonCodec json = JsonCodec.getDefault();

    public WebhookController(EventIngestor ingestor, MeetflowServerProperties props) {
        this.ingestor = ingestor;
        this.props = props;
    }

    @PostMapping("/{platform}")
    public ResponseEntity<?> receive(@PathVariable("platform") String path,
            @RequestParam(name = "validationToken", required = false) String validationToken,
            @RequestBody(required = false) String body) {
        Platform platform = PLATFORMS.get(path);
        if (platform == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Unknown platform: " + path));
        }
        if (platform == Platform.MICROSOFT_TEAMS && validationToken != null) {
            log.info("Answering Graph subscription validation");
            return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(validationToken);
        }

        List<IngestResult> results;
        try {
            if (platform == Platform.ZOOM) {
                JsonNode root = json.readTree(body);
                if (ZoomEventAdapter.URL_VALIDATION.equals(root.path("event").asText())) {
                    String plainToken = root.path("payload").path("plainToken").asText(null);
                    if (plainToken == null) {
                        return badRequest("url_validation without plainToken");
                    }
                    log.info("Answering Zoom URL validation challenge");
                    return ResponseEntity.ok(ZoomUrlValidation.respond(plainToken, props.getZoomSecretToken()));
                }
            }
            results = ingestor.ingestDelivery(platform, body);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} webhook: {}", platform.code(), e.getMessage());
            return badRequest(e.getMessage());
        }

        boolean anyCreated = results.stream().anyMatch(IngestResult::created);
        List<Map<String, Object>> events = results.stream()
            .map(r -> Map.<String, Object>of(
                "rawEventId", r.rawEventId(),
                "externalEventId", r.externalEventId(),
                "duplicate", !r.created()))
            .toList();
        log.info("{} webhook: {} event(s), {} new", platform.code(), results.size(),
            results.stream().filter(IngestResult::created).count());
        return ResponseEntity.status(anyCreated ? HttpStatus.ACCEPTED : HttpStatus.OK)
            .body(Map.of("received", true, "events", events));
    }

    /**
     * Graph may validate a subscription with a GET before the first notification.
     */
    @GetMapping(value = "/teams")
    public ResponseEntity<String> validateTeams(
            @RequestParam(name = "validationToken", required = false) String validationToken) {
        if (validationToken == null) {
            return ResponseEntity.badRequest().contentType(MediaType.TEXT_PLAIN).body("Missing validationToken");
        }
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(validationToken);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("received", false, "error", message));
    }
}
