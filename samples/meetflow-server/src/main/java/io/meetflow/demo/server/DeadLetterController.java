package io.meetflow.demo.server;

import io.meetflow.dead.DeadLetterManager;
import io.meetflow.model.DeadLetter;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator view of failures that exhausted their retries.
 */
@RestController
@RequestMapping("/dead-letters")
public class DeadLetterController {

    private final DeadLetterManager deadLetters;

    public DeadLetterController(DeadLetterManager deadLetters) {
        this.deadLetters = deadLetters;
    }

    @GetMapping
    public Map<String, Object> list(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        List<Map<String, Object>> items = deadLetters.listUnresolved(Math.max(1, Math.min(limit, 500)))
            .stream()
            .map(DeadLetterController::toJson)
            .toList();
        return Map.of("unresolved", deadLetters.countUnresolved(), "deadLetters", items);
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<Map<String, Object>> resolve(@PathVariable("id") String id,
            @RequestBody(required = false) ResolutionRequest request) {
        String notes = request != null ? request.notes() : null;
        return outcome(id, deadLetters.resolve(id, notes), "resolved");
    }

    @PostMapping("/{id}/replay")
    public ResponseEntity<Map<String, Object>> replay(@PathVariable("id") String id,
            @RequestBody(required = false) ResolutionRequest request) {
        String notes = request != null ? request.notes() : null;
        return outcome(id, deadLetters.replay(id, notes), "replayed");
    }

    private ResponseEntity<Map<String, Object>> outcome(String id, boolean applied, String action) {
        if (applied) {
            return ResponseEntity.ok(Map.of(action, true, "id", id));
        }
        if (deadLetters.find(id).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Dead letter not found"));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(action, false, "error", "Already resolved"));
    }

    private static Map<String, Object> toJson(DeadLetter deadLetter) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", deadLetter.id());
        json.put("platform", deadLetter.platform().code());
        json.put("eventType", deadLetter.eventType());
        json.put("step", deadLetter.step().code());
        json.put("referenceId", deadLetter.referenceId());
        json.put("error", deadLetter.error());
        json.put("totalAttempts", deadLetter.totalAttempts());
        json.put("failureHistory", deadLetter.failureHistory().stream()
            .map(entry -> Map.of(
                "attempt", entry.attempt(),
                "error", String.valueOf(entry.error()),
                "timestamp", entry.timestamp().toString()))
            .toList());
        json.put("alertSent", deadLetter.alertSent());
        json.put("createdAt", deadLetter.createdAt().toString());
        return json;
    }

    public record ResolutionRequest(String notes) {}
}
