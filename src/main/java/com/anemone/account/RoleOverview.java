package com.anemone.account;

import com.anemone.chain.RoleData;
import com.anemone.chain.SkillDetails;

import java.util.List;

/**
 * On-chain role together with the details of every skill it owns.
 */
public record RoleOverview(
        RoleData role,
        List<SkillDetails> skills
) {
}
