package io.meetflow.demo.server;

import io.meetflow.progress.ProcessingStateMachine;
import io.meetflow.progress.ProcessingStatus;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/meetings")
public class MeetingController {

    private final ProcessingStateMachine stateMachine;

    public MeetingController(ProcessingStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<Map<String, Object>> status(@PathVariable("id") String meetingId) {
        return stateMachine.status(meetingId)
            .map(status -> ResponseEntity.ok(toJson(status)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.<String, Object>of("error", "Meeting not found")));
    }

    /**
     * Re-drives a failed meeting. Answers 409 when the meeting is not failed.
     */
    @PostMapping("/{id}/restart")
    public ResponseEntity<Map<String, Object>> restart(@PathVariable("id") String meetingId) {
        if (stateMachine.find(meetingId).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Meeting not found"));
        }
        if (!stateMachine.restart(meetingId)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("restarted", false, "error", "Only failed meetings can be restarted"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("restarted", true, "meetingId", meetingId));
    }

    private static Map<String, Object> toJson(ProcessingStatus status) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("meetingId", status.meetingId());
        json.put("status", status.status().code());
        json.put("step", status.step().code());
        json.put("progress", status.progress());
        json.put("label", status.label());
        json.put("error", status.error());
        json.put("estimatedRemainingMs", status.estimatedRemaining().toMillis());
        json.put("startedAt", text(status.startedAt()));
        json.put("completedAt", text(status.completedAt()));
        List<Map<String, Object>> logs = status.logs().stream().map(entry -> {
            Map<String, Object> log = new LinkedHashMap<>();
            log.put("timestamp", text(entry.timestamp()));
            log.put("step", entry.step().code());
            log.put("message", entry.message());
            log.put("durationMs", entry.durationMs());
            return log;
        }).toList();
        json.put("logs", logs);
        return json;
    }

    private static String text(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
