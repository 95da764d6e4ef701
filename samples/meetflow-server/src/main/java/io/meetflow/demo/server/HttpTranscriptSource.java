package io.meetflow.demo.server;

import io.meetflow.model.Meeting;
import io.meetflow.model.Platform;
import io.meetflow.model.Transcript;
import io.meetflow.spi.AccessTokenProvider;
import io.meetflow.spi.TranscriptSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Downloads transcripts over HTTP with a {@link RestTemplate} whose timeouts bound every call.
 *
 * <ul>
 *   <li>Zoom: the {@code download_url} from the webhook, already carrying its download token</li>
 *   <li>Google Meet: {@code GET {meetApi}/{transcriptName}/entries}</li>
 *   <li>Teams: {@code GET {graphApi}/{resource}/content} as {@code text/vtt}</li>
 * </ul>
 */
public class HttpTranscriptSource implements TranscriptSource {
    private static final Logger log = LoggerFactory.getLogger(HttpTranscriptSource.class);
    private static final MediaType TEXT_VTT = MediaType.valueOf("text/vtt");

    private final RestTemplate restTemplate;
    private final AccessTokenProvider accessTokens;
    private final String meetApiBaseUrl;
    private final String graphApiBaseUrl;

    public HttpTranscriptSource(RestTemplate restTemplate, AccessTokenProvider accessTokens,
            String meetApiBaseUrl, String graphApiBaseUrl) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.accessTokens = Objects.requireNonNull(accessTokens, "accessTokens");
        this.meetApiBaseUrl = trimSlash(Objects.requireNonNull(meetApiBaseUrl, "meetApiBaseUrl"));
        this.graphApiBaseUrl = trimSlash(Objects.requireNonNull(graphApiBaseUrl, "graphApiBaseUrl"));
    }

    @Override
    public String fetch(Meeting meeting, Transcript transcript) throws IOException {
        if (transcript.sourceRef() == null) {
            throw new IOException("Meeting " + meeting.id() + " has no transcript location");
        }
        URI uri = URI.create(resolve(meeting.platform(), transcript.sourceRef()));

        HttpHeaders headers = new HttpHeaders();
        if (meeting.platform() == Platform.MICROSOFT_TEAMS) {
            headers.setAccept(List.of(TEXT_VTT, MediaType.TEXT_PLAIN));
        } else if (meeting.platform() == Platform.GOOGLE_MEET) {
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        }
        accessTokens.accessToken(meeting.platform(), meeting.hostEmail()).ifPresent(headers::setBearerAuth);

        log.debug("Fetching {} transcript for meeting {} from {}", meeting.platform().code(), meeting.id(), uri.getHost());
        try {
            ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw new IOException("Empty transcript response for meeting " + meeting.id());
            }
            return body;
        } catch (RestClientResponseException e) {
            throw new IOException("HTTP " + e.getStatusCode().value() + " fetching transcript for meeting "
                + meeting.id(), e);
        } catch (ResourceAccessException e) {
            throw new IOException("Transcript download failed for meeting " + meeting.id() + ": " + e.getMessage(), e);
        }
    }

    // TODO: follow nextPageToken on Meet entries; long meetings span several pages
    String resolve(Platform platform, String sourceRef) {
        return switch (platform) {
            case ZOOM -> sourceRef;
            case GOOGLE_MEET -> meetApiBaseUrl + "/" + stripLeadingSlash(sourceRef) + "/entries";
            case MICROSOFT_TEAMS -> sourceRef.startsWith("http")
                ? sourceRef
                : graphApiBaseUrl + "/" + stripLeadingSlash(sourceRef) + "/content";
        };
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String stripLeadingSlash(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
