package com.anemone.orchestration.model;

import java.util.List;

/**
 * Structured classifier answer: {@code {"reasoning": "...", "commands": ["queryRoleData", ...]}}.
 */
public record CommandSelection(
        String reasoning,
        List<String> commands
) {
}
