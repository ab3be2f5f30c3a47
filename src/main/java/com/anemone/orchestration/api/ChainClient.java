package com.anemone.orchestration.api;

import com.anemone.chain.RoleData;
import com.anemone.chain.SkillDetails;
import org.springframework.lang.Nullable;

/**
 * Read access to the agent's on-chain objects.
 */
public interface ChainClient {

    /**
     * @return the role object, or {@code null} when it does not exist or could not be decoded
     */
    @Nullable
    RoleData getRoleData(String roleId);

    /**
     * @return the skill object, or {@code null} when it does not exist or could not be decoded
     */
    @Nullable
    SkillDetails getSkillDetails(String skillId);
}
