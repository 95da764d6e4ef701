package io.meetflow.demo.server;

import io.meetflow.model.FailureStatus;
import io.meetflow.model.Platform;
import io.meetflow.retry.FailureMetrics;
import io.meetflow.retry.WebhookFailureQueue;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/webhook-failures")
public class WebhookFailureController {

    private final WebhookFailureQueue failureQueue;

    public WebhookFailureController(WebhookFailureQueue failureQueue) {
        this.failureQueue = failureQueue;
    }

    @GetMapping("/metrics")
    public Map<String, Object> metrics() {
        FailureMetrics metrics = failureQueue.metrics();
        Map<String, Object> byPlatform = new LinkedHashMap<>();
        for (Platform platform : Platform.values()) {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (FailureStatus status : FailureStatus.values()) {
                counts.put(status.code(), metrics.count(platform, status));
            }
            byPlatform.put(platform.code(), counts);
        }
        Map<String, Long> totals = new LinkedHashMap<>();
        for (FailureStatus status : FailureStatus.values()) {
            totals.put(status.code(), metrics.count(status));
        }

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("queueDepth", metrics.queueDepth());
        json.put("totals", totals);
        json.put("byPlatform", byPlatform);
        return json;
    }
}
