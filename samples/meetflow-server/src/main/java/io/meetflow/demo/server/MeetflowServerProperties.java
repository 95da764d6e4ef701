package io.meetflow.demo.server;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Platform endpoints and secrets used by the server.
 */
@ConfigurationProperties(prefix = "meetflow.server")
public class MeetflowServerProperties {

    /**
     * Secret token of the Zoom app, used to answer {@code endpoint.url_validation}.
     */
    private String zoomSecretToken;
    private String meetApiBaseUrl = "https://meet.googleapis.com/v2";
    private String graphApiBaseUrl = "https://graph.microsoft.com/v1.0";

    public String getZoomSecretToken() {
        return zoomSecretToken;
    }

    public void setZoomSecretToken(String zoomSecretToken) {
        this.zoomSecretToken = zoomSecretToken;
    }

    public String getMeetApiBaseUrl() {
        return meetApiBaseUrl;
    }

    public void setMeetApiBaseUrl(String meetApiBaseUrl) {
        this.meetApiBaseUrl = meetApiBaseUrl;
    }

    public String getGraphApiBaseUrl() {
        return graphApiBaseUrl;
    }

    public void setGraphApiBaseUrl(String graphApiBaseUrl) {
        this.graphApiBaseUrl = graphApiBaseUrl;
    }
}
