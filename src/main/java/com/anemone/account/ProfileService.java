package com.anemone.account;

import com.anemone.chain.RoleData;
import com.anemone.chain.SkillDetails;
import com.anemone.entity.AgentProfile;
import com.anemone.events.AgentEventType;
import com.anemone.events.EventBus;
import com.anemone.orchestration.api.ChainClient;
import com.anemone.repository.AgentProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileService {

    private final AgentProfileRepository profileRepository;
    private final ChainClient chainClient;
    private final EventBus eventBus;

    /**
     * Creates the agent profile, or points the existing one at a new role and package.
     */
    @Transactional
    public ProfileInfo initProfile(String roleId, String packageId) {
        if (!StringUtils.hasText(roleId) || !StringUtils.hasText(packageId)) {
            throw new IllegalArgumentException("roleId and packageId are required");
        }
        AgentProfile profile = profileRepository.findFirstByOrderByUpdatedAtDesc()
                .orElseGet(AgentProfile::new);
        profile.setRoleId(roleId.trim());
        profile.setPackageId(packageId.trim());
        ProfileInfo saved = ProfileInfo.from(profileRepository.saveAndFlush(profile));
        log.info("Profile initialised with role {} and package {}.", saved.roleId(), saved.packageId());
        eventBus.publish(AgentEventType.PROFILE_UPDATED, Map.of(
                "roleId", saved.roleId(),
                "packageId", saved.packageId()));
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<ProfileInfo> getProfile() {
        return profileRepository.findFirstByOrderByUpdatedAtDesc().map(ProfileInfo::from);
    }

    public Optional<RoleData> getRoleData() {
        return getProfile().map(profile -> chainClient.getRoleData(profile.roleId()));
    }

    /**
     * Skill details for every skill id on the role. Skills that cannot be read are left out. Empty when the role
     * itself cannot be read, so callers can tell "no skills" from "no data".
     */
    public Optional<List<SkillDetails>> getSkillDetails() {
        return getRoleData().map(this::loadSkills);
    }

    public Optional<RoleOverview> getRoleOverview() {
        return getRoleData().map(role -> new RoleOverview(role, loadSkills(role)));
    }

    private List<SkillDetails> loadSkills(RoleData role) {
        List<SkillDetails> skills = new ArrayList<>();
        for (String skillId : role.skills()) {
            SkillDetails details = chainClient.getSkillDetails(skillId);
            if (details == null) {
                log.warn("Skill {} of role {} could not be read.", skillId, role.id());
                continue;
            }
            skills.add(details);
        }
        return skills;
    }
}
