package com.anemone.account;

import com.anemone.entity.AgentProfile;

import java.time.OffsetDateTime;

public record ProfileInfo(
        String roleId,
        String packageId,
        OffsetDateTime updatedAt
) {

    static ProfileInfo from(AgentProfile profile) {
        return new ProfileInfo(profile.getRoleId(), profile.getPackageId(), profile.getUpdatedAt());
    }
}
