package com.autolike.api;

import com.autolike.infrastructure.stream.FeedStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the stream for operators.
 */
@RestController
@RequestMapping("/api/v1/feed")
@RequiredArgsConstructor
public class FeedStatusController {

    private final FeedStatus feedStatus;

    /**
     * GET /api/v1/feed/status
     */
    @GetMapping("/status")
    public ResponseEntity<FeedStatus.Snapshot> status() {
        return ResponseEntity.ok(feedStatus.snapshot());
    }
}
