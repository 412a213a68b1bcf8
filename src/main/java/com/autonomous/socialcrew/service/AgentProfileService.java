package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.model.AgentProfile;
import com.autonomous.socialcrew.model.AgentRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads per-agent YAML profiles (description, timeout override, enabled flag).
 */
@Slf4j
@Service
public class AgentProfileService {

    @Value("${agent.profiles.path:config/agents}")
    private String profilesPath;

    private final Map<AgentRole, AgentProfile> profiles = new EnumMap<>(AgentRole.class);
    private final ObjectMapper yamlMapper;

    public AgentProfileService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setProfilesPath(String path) {
        this.profilesPath = path;
    }

    @PostConstruct
    public synchronized void loadProfiles() {
        profiles.clear();
        File profileDir = new File(profilesPath);

        if (!profileDir.exists() || !profileDir.isDirectory()) {
            log.info("Agent profile directory not found: {}, using defaults", profilesPath);
            return;
        }

        File[] yamlFiles = profileDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) return;

        for (File file : yamlFiles) {
            try {
                AgentProfile profile = yamlMapper.readValue(file, AgentProfile.class);
                if (profile.getRole() != null) {
                    profiles.put(profile.getRole(), profile);
                    log.info("Loaded agent profile for {}", profile.getRole().getWireName());
                }
            } catch (Exception e) {
                log.warn("Failed to load agent profile from {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    public synchronized Optional<AgentProfile> getProfile(AgentRole role) {
        return Optional.ofNullable(profiles.get(role));
    }
}
