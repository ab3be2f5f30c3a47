package com.anemone.orchestration.service;

import com.anemone.orchestration.model.Command;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.anemone.orchestration.OrchestrationConstants.EXECUTE_MARKER;
import static com.anemone.orchestration.OrchestrationConstants.TOOLS_HEADER;

/**
 * Extracts commands from free model text. Understands {@code $execute:<token>} markers anywhere in the text
 * and the {@code Tools to use:} block with one {@code $token} per line.
 */
@Component
@Slf4j
public class CommandMarkerParser {

    private static final Pattern MARKER_PATTERN = Pattern.compile(Pattern.quote(EXECUTE_MARKER) + "([A-Za-z]+)");
    private static final Pattern TOOL_LINE = Pattern.compile("^\\s*[-*]?\\s*\\$([A-Za-z]+)\\s*$");

    public List<Command> parse(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            return List.of();
        }
        List<Command> commands = new ArrayList<>();
        Matcher matcher = MARKER_PATTERN.matcher(text);
        while (matcher.find()) {
            resolve(matcher.group(1)).ifPresent(commands::add);
        }
        if (commands.isEmpty()) {
            commands.addAll(parseToolBlock(text));
        }
        return commands;
    }

    public boolean containsMarker(@Nullable String text) {
        return !parse(text).isEmpty();
    }

    private List<Command> parseToolBlock(String text) {
        int header = text.indexOf(TOOLS_HEADER);
        if (header < 0) {
            return List.of();
        }
        List<Command> commands = new ArrayList<>();
        String[] lines = text.substring(header + TOOLS_HEADER.length()).split("\\R");
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            Matcher matcher = TOOL_LINE.matcher(line);
            if (!matcher.matches()) {
                if (!commands.isEmpty()) {
                    break;
                }
                continue;
            }
            resolve(matcher.group(1)).ifPresent(commands::add);
        }
        return commands;
    }

    private Optional<Command> resolve(String token) {
        Optional<Command> command = Command.fromToken(token);
        if (command.isEmpty()) {
            log.debug("Ignoring unknown command token {}.", token);
        }
        return command;
    }
}
