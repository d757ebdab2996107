package com.ai.bookingbot.controller;

import com.ai.bookingbot.dto.SessionSummaryDto;
import com.ai.bookingbot.service.SessionStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/providers")
public class SessionController {

    private final SessionStore sessionStore;
    private final Clock clock;

    public SessionController(SessionStore sessionStore, Clock clock) {
        this.sessionStore = sessionStore;
        this.clock = clock;
    }

    /**
     * Conversations still in progress; idle and terminal ones are left out.
     */
    @GetMapping("/{providerId}/sessions/active")
    public List<SessionSummaryDto> activeSessions(@PathVariable Long providerId) {
        return sessionStore.listActive(providerId, clock.instant()).stream()
                .map(SessionSummaryDto::from)
                .collect(Collectors.toList());
    }
}
