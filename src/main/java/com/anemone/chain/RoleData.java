package com.anemone.chain;

import java.math.BigInteger;
import java.util.List;

/**
 * On-chain role object. Move u64 fields are kept as {@link BigInteger}.
 */
public record RoleData(
        String id,
        String botNftId,
        BigInteger health,
        boolean isActive,
        boolean isLocked,
        BigInteger lastEpoch,
        BigInteger inactiveEpochs,
        BigInteger balance,
        String botAddress,
        List<String> skills,
        String appId
) {

    public RoleData {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
