package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.agent.AgentCapability;
import com.autonomous.socialcrew.exception.DuplicateRoleException;
import com.autonomous.socialcrew.exception.NoAgentForTypeException;
import com.autonomous.socialcrew.model.AgentProfile;
import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.TaskType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentRegistryTest {

    @Mock
    private AgentProfileService profileService;

    private final StubCapability writer = StubCapability.succeeding(AgentRole.CONTENT_WRITER, TaskType.CONTENT_GENERATION);
    private final StubCapability analyst = StubCapability.succeeding(AgentRole.TRAFFIC_ANALYST, TaskType.TREND_ANALYSIS);

    @Test
    void shouldResolveRegisteredType() {
        when(profileService.getProfile(any())).thenReturn(Optional.empty());
        AgentRegistry registry = new AgentRegistry(List.of(writer, analyst), profileService);
        registry.init();

        assertEquals(AgentRole.CONTENT_WRITER, registry.resolve(TaskType.CONTENT_GENERATION));
        assertEquals(AgentRole.TRAFFIC_ANALYST, registry.resolve(TaskType.TREND_ANALYSIS));
        assertNull(registry.descriptor(AgentRole.TRAFFIC_ANALYST).getTimeout());
    }

    @Test
    void shouldFailToResolveUnclaimedType() {
        when(profileService.getProfile(any())).thenReturn(Optional.empty());
        AgentRegistry registry = new AgentRegistry(List.of(writer), profileService);
        registry.init();

        assertThrows(NoAgentForTypeException.class, () -> registry.resolve(TaskType.VIDEO_PLANNING));
    }

    @Test
    void shouldRejectDuplicateRole() {
        AgentRegistry registry = new AgentRegistry(List.of(), profileService);
        registry.register(AgentRole.CONTENT_WRITER, Set.of(TaskType.CONTENT_GENERATION), writer);

        assertThrows(DuplicateRoleException.class,
            () -> registry.register(AgentRole.CONTENT_WRITER, Set.of(TaskType.TREND_ANALYSIS), analyst));
        assertEquals(AgentRole.CONTENT_WRITER, registry.resolve(TaskType.CONTENT_GENERATION));
    }

    @Test
    void shouldRejectTypeClaimedByTwoRoles() {
        AgentRegistry registry = new AgentRegistry(List.of(), profileService);
        registry.register(AgentRole.CONTENT_WRITER, Set.of(TaskType.CONTENT_GENERATION), writer);
        registry.register(AgentRole.SCRIPT_WRITER, Set.of(TaskType.CONTENT_GENERATION), analyst);

        assertThrows(NoAgentForTypeException.class, registry::freeze);
        assertThrows(NoAgentForTypeException.class, () -> registry.resolve(TaskType.CONTENT_GENERATION));
    }

    @Test
    void shouldBeReadOnlyAfterStartup() {
        when(profileService.getProfile(any())).thenReturn(Optional.empty());
        AgentRegistry registry = new AgentRegistry(List.of(writer), profileService);
        registry.init();

        assertThrows(IllegalStateException.class,
            () -> registry.register(AgentRole.TRAFFIC_ANALYST, Set.of(TaskType.TREND_ANALYSIS), analyst));
    }

    @Test
    void shouldApplyProfileOverrides() {
        AgentProfile analystProfile = new AgentProfile();
        analystProfile.setRole(AgentRole.TRAFFIC_ANALYST);
        analystProfile.setDescription("Trend watcher");
        analystProfile.setTimeoutMs(2000L);
        AgentProfile writerProfile = new AgentProfile();
        writerProfile.setRole(AgentRole.CONTENT_WRITER);
        writerProfile.setEnabled(false);

        when(profileService.getProfile(AgentRole.TRAFFIC_ANALYST)).thenReturn(Optional.of(analystProfile));
        when(profileService.getProfile(AgentRole.CONTENT_WRITER)).thenReturn(Optional.of(writerProfile));

        List<AgentCapability> capabilities = List.of(writer, analyst);
        AgentRegistry registry = new AgentRegistry(capabilities, profileService);
        registry.init();

        assertEquals("Trend watcher", registry.descriptor(AgentRole.TRAFFIC_ANALYST).getDescription());
        assertEquals(Duration.ofSeconds(2), registry.descriptor(AgentRole.TRAFFIC_ANALYST).getTimeout());
        assertThrows(NoAgentForTypeException.class, () -> registry.resolve(TaskType.CONTENT_GENERATION));
        assertEquals(1, registry.descriptors().size());
    }
}
