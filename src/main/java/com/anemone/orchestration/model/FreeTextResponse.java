package com.anemone.orchestration.model;

import java.util.List;

/**
 * Outcome of the marker-based response path.
 *
 * @param text completion text; for a degraded response it already carries the unverified-data warning
 * @param commands commands extracted from markers, or {@code [NONE]} when the output was coerced
 * @param attempts completion calls made
 * @param degraded {@code true} when no attempt produced an actionable completion
 */
public record FreeTextResponse(
        String text,
        List<Command> commands,
        int attempts,
        boolean degraded
) {

    public boolean actionable() {
        return !commands.isEmpty();
    }
}
