package com.anemone.account;

import com.anemone.chain.RoleData;
import com.anemone.chain.SkillDetails;
import com.anemone.entity.AgentProfile;
import com.anemone.events.AgentEvent;
import com.anemone.events.AgentEventType;
import com.anemone.events.EventBus;
import com.anemone.orchestration.api.ChainClient;
import com.anemone.repository.AgentProfileRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProfileServiceTest {

    private final AgentProfileRepository profileRepository = mock(AgentProfileRepository.class);
    private final ChainClient chainClient = mock(ChainClient.class);
    private final AtomicReference<AgentEvent> updated = new AtomicReference<>();
    private EventBus eventBus;
    private ProfileService profileService;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        eventBus.subscribe(AgentEventType.PROFILE_UPDATED, updated::set);
        profileService = new ProfileService(profileRepository, chainClient, eventBus);
    }

    @AfterEach
    void tearDown() {
        eventBus.close();
    }

    @Test
    void testInitProfile_UpdatesExistingProfile() {
        AgentProfile existing = AgentProfile.builder().roleId("0xold").packageId("0xpkg-old").build();
        when(profileRepository.findFirstByOrderByUpdatedAtDesc()).thenReturn(Optional.of(existing));
        when(profileRepository.saveAndFlush(any(AgentProfile.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ProfileInfo info = profileService.initProfile(" 0xrole ", "0xpkg");

        assertEquals("0xrole", info.roleId());
        assertEquals("0xrole", existing.getRoleId());
        assertEquals("0xpkg", existing.getPackageId());
        assertEquals("0xrole", updated.get().stringValue("roleId"));
    }

    @Test
    void testInitProfile_RequiresIds() {
        assertThrows(IllegalArgumentException.class, () -> profileService.initProfile("0xrole", ""));
    }

    @Test
    void testGetRoleData_NoProfile() {
        when(profileRepository.findFirstByOrderByUpdatedAtDesc()).thenReturn(Optional.empty());

        assertTrue(profileService.getRoleData().isEmpty());
    }

    @Test
    void testGetSkillDetails_SkipsUnreadableSkills() {
        givenProfile();
        when(chainClient.getRoleData("0xrole")).thenReturn(role(List.of("0xs1", "0xs2")));
        SkillDetails trading = new SkillDetails("0xs1", "trading", "Trades on DEXes", BigInteger.TEN, true, "0xauthor");
        when(chainClient.getSkillDetails("0xs1")).thenReturn(trading);
        when(chainClient.getSkillDetails("0xs2")).thenReturn(null);

        assertEquals(Optional.of(List.of(trading)), profileService.getSkillDetails());
    }

    @Test
    void testGetRoleOverview_RoleUnreadable() {
        givenProfile();
        when(chainClient.getRoleData("0xrole")).thenReturn(null);

        assertTrue(profileService.getRoleOverview().isEmpty());
        assertTrue(profileService.getSkillDetails().isEmpty());
    }

    @Test
    void testGetSkillDetails_RoleWithoutSkills() {
        givenProfile();
        when(chainClient.getRoleData("0xrole")).thenReturn(role(List.of()));

        assertEquals(Optional.of(List.of()), profileService.getSkillDetails());
    }

    @Test
    void testGetSkillDetails_NoProfile() {
        when(profileRepository.findFirstByOrderByUpdatedAtDesc()).thenReturn(Optional.empty());

        assertTrue(profileService.getSkillDetails().isEmpty());
    }

    private void givenProfile() {
        AgentProfile profile = AgentProfile.builder()
                .roleId("0xrole")
                .packageId("0xpkg")
                .updatedAt(OffsetDateTime.now())
                .build();
        when(profileRepository.findFirstByOrderByUpdatedAtDesc()).thenReturn(Optional.of(profile));
    }

    private static RoleData role(List<String> skills) {
        return new RoleData("0xrole", "0xnft", BigInteger.valueOf(87), true, false, BigInteger.ONE, BigInteger.ZERO,
                BigInteger.valueOf(1_500_000_000L), "0xbot", skills, "app");
    }
}
