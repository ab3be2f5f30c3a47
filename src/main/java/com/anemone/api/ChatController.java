package com.anemone.api;

import com.anemone.orchestration.AgentCoordinator;
import com.anemone.orchestration.model.ChatResult;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private static final int MAX_HISTORY = 200;

    private final AgentCoordinator agentCoordinator;

    public ChatController(AgentCoordinator agentCoordinator) {
        this.agentCoordinator = agentCoordinator;
    }

    @PostMapping
    public ChatResult chat(@Valid @RequestBody ChatRequest request) {
        return agentCoordinator.processChat(request.message(), request.userId(), request.roleId());
    }

    @GetMapping("/history")
    public ChatHistoryResponse history(@RequestParam(required = false) String userId,
                                       @RequestParam(defaultValue = "50") int limit,
                                       @RequestParam(required = false)
                                       @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime before) {
        if (userId == null || userId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required.");
        }
        if (limit <= 0 || limit > MAX_HISTORY) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_HISTORY + ".");
        }
        return ChatHistoryResponse.from(userId, agentCoordinator.getChatHistory(userId, limit, before));
    }
}
