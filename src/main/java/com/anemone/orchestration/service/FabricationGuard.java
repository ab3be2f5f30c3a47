package com.anemone.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Heuristic check for figures the model states without having fetched them. Precision depends on the
 * configured patterns.
 */
@Slf4j
public class FabricationGuard {

    private final List<Pattern> patterns;

    public FabricationGuard(List<String> patterns) {
        this.patterns = patterns.stream().map(Pattern::compile).toList();
    }

    public boolean containsNumericClaim(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                log.debug("Numeric claim matched pattern {}.", pattern.pattern());
                return true;
            }
        }
        return false;
    }
}
