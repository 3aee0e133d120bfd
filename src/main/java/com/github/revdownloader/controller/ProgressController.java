package com.github.revdownloader.controller;

import com.github.revdownloader.model.LogEntry;
import com.github.revdownloader.service.EventBroadcastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ProgressController {

    private final EventBroadcastService eventBroadcastService;

    /**
     * SSE endpoint for log, progress and result events
     */
    @GetMapping("/events/stream")
    public SseEmitter streamEvents() {
        log.info("New SSE connection established");
        return eventBroadcastService.createEmitter();
    }

    /**
     * Recent log entries, oldest first
     */
    @GetMapping("/logs")
    public ResponseEntity<List<LogEntry>> recentLog() {
        return ResponseEntity.ok(eventBroadcastService.getRecentLog());
    }
}
