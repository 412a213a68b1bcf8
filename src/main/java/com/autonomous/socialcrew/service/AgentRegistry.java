package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.agent.AgentCapability;
import com.autonomous.socialcrew.agent.AgentDescriptor;
import com.autonomous.socialcrew.exception.DuplicateRoleException;
import com.autonomous.socialcrew.exception.NoAgentForTypeException;
import com.autonomous.socialcrew.model.AgentProfile;
import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.TaskType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps agent roles to their capabilities. Filled once at startup and read-only afterwards.
 */
@Slf4j
@Service
public class AgentRegistry {

    private final List<AgentCapability> capabilities;
    private final AgentProfileService profileService;

    private final Map<AgentRole, AgentDescriptor> registrations = new EnumMap<>(AgentRole.class);
    private volatile Map<AgentRole, AgentDescriptor> frozen;

    public AgentRegistry(List<AgentCapability> capabilities, AgentProfileService profileService) {
        this.capabilities = capabilities;
        this.profileService = profileService;
    }

    @PostConstruct
    public void init() {
        for (AgentCapability capability : capabilities) {
            Optional<AgentProfile> profile = profileService.getProfile(capability.role());
            if (profile.isPresent() && !profile.get().isEnabled()) {
                log.info("Agent {} disabled by profile", capability.role().getWireName());
                continue;
            }
            register(new AgentDescriptor(
                capability.role(),
                Set.copyOf(capability.acceptedTaskTypes()),
                capability,
                profile.map(AgentProfile::getDescription).orElse(capability.role().getWireName()),
                profile.map(AgentProfile::getTimeoutMs).map(Duration::ofMillis).orElse(null)
            ));
        }
        freeze();
    }

    public void register(AgentRole role, Set<TaskType> acceptedTaskTypes, AgentCapability capability) {
        register(new AgentDescriptor(role, Set.copyOf(acceptedTaskTypes), capability, role.getWireName(), null));
    }

    public synchronized void register(AgentDescriptor descriptor) {
        if (frozen != null) {
            throw new IllegalStateException("Agent registry is read-only after startup");
        }
        if (registrations.containsKey(descriptor.getRole())) {
            throw new DuplicateRoleException("Agent role already registered: " + descriptor.getRole().getWireName());
        }
        registrations.put(descriptor.getRole(), descriptor);
        log.info("Registered agent {} for {}", descriptor.getRole().getWireName(), descriptor.getAcceptedTaskTypes());
    }

    /**
     * Ends registration. Fails if any task type is claimed by more than one role.
     */
    public synchronized void freeze() {
        for (TaskType type : TaskType.values()) {
            List<AgentRole> claims = claimsFor(type, registrations.values());
            if (claims.size() > 1) {
                throw new NoAgentForTypeException(
                    String.format("Task type %s is claimed by several agents: %s", type.getWireName(), claims));
            }
        }
        frozen = Map.copyOf(registrations);
    }

    public AgentRole resolve(TaskType type) {
        List<AgentRole> claims = claimsFor(type, view().values());
        if (claims.size() != 1) {
            throw new NoAgentForTypeException(claims.isEmpty()
                ? "No agent accepts task type " + type.getWireName()
                : String.format("Task type %s is claimed by several agents: %s", type.getWireName(), claims));
        }
        return claims.get(0);
    }

    public AgentDescriptor descriptor(AgentRole role) {
        AgentDescriptor descriptor = view().get(role);
        if (descriptor == null) {
            throw new NoAgentForTypeException("No agent registered for role " + role.getWireName());
        }
        return descriptor;
    }

    public List<AgentDescriptor> descriptors() {
        List<AgentDescriptor> all = new ArrayList<>(view().values());
        all.sort((a, b) -> a.getRole().compareTo(b.getRole()));
        return all;
    }

    private Map<AgentRole, AgentDescriptor> view() {
        Map<AgentRole, AgentDescriptor> snapshot = frozen;
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (this) {
            return Map.copyOf(registrations);
        }
    }

    private static List<AgentRole> claimsFor(TaskType type, Collection<AgentDescriptor> descriptors) {
        return descriptors.stream()
            .filter(descriptor -> descriptor.getAcceptedTaskTypes().contains(type))
            .map(AgentDescriptor::getRole)
            .sorted()
            .toList();
    }
}
