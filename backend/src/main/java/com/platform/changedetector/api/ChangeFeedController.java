package com.platform.changedetector.api;

import com.platform.changedetector.detector.ChangeStreamStatus;
import com.platform.changedetector.feed.ChangeFeedRunner;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-only view of the running change feed.
 */
@RestController
@RequestMapping("/api/change-feed")
@RequiredArgsConstructor
public class ChangeFeedController {
    
    private final ChangeFeedRunner changeFeedRunner;
    
    /**
     * Status of the active change stream; 204 when the feed is disabled or not started.
     */
    @GetMapping
    public ResponseEntity<ChangeStreamStatus> getStatus() {
        return changeFeedRunner.getStatus()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }
    
    /**
     * Simple liveness probe.
     */
    @GetMapping("/live")
    public ResponseEntity<Map<String, String>> liveness() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
