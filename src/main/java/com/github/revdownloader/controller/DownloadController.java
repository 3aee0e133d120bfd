package com.github.revdownloader.controller;

import com.github.revdownloader.model.SessionResult;
import com.github.revdownloader.model.SessionView;
import com.github.revdownloader.service.session.SessionController;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class DownloadController {

    private final SessionController sessionController;

    /**
     * Start a download session
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startSession(@Valid @RequestBody StartSessionRequest request) {
        log.info("Starting session for: {}", request.getUrl());
        String sessionId = sessionController.startSession(request.getUrl(), request.getOptions());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("sessionId", sessionId));
    }

    /**
     * Get session state with its items
     */
    @GetMapping("/{id}")
    public ResponseEntity<SessionView> getSession(@PathVariable String id) {
        return ResponseEntity.ok(SessionView.of(sessionController.getSession(id), sessionController.isActive(id)));
    }

    /**
     * Get the final result; 204 while the session is still running
     */
    @GetMapping("/{id}/result")
    public ResponseEntity<SessionResult> getResult(@PathVariable String id) {
        return sessionController.getResult(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    /**
     * Cancel session
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Boolean>> cancelSession(@PathVariable String id) {
        boolean cancelled = sessionController.cancel(id);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }
}
