package com.anemone.chain;

import java.math.BigInteger;

public record SkillDetails(
        String id,
        String name,
        String description,
        BigInteger fee,
        boolean isEnabled,
        String author
) {
}
