package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.model.AgentProfile;
import com.autonomous.socialcrew.model.AgentRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AgentProfileServiceTest {

    private AgentProfileService profileService;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        profileService = new AgentProfileService();
        profileService.setProfilesPath(tempDir.toString());
    }

    @Test
    void shouldLoadProfileFromYaml() throws Exception {
        File profileFile = tempDir.resolve("traffic_analyst.yaml").toFile();
        try (FileWriter writer = new FileWriter(profileFile)) {
            writer.write("role: traffic_analyst\n");
            writer.write("description: Watches hashtags\n");
            writer.write("timeout_ms: 1500\n");
        }

        profileService.loadProfiles();
        Optional<AgentProfile> profile = profileService.getProfile(AgentRole.TRAFFIC_ANALYST);

        assertTrue(profile.isPresent());
        assertEquals("Watches hashtags", profile.get().getDescription());
        assertEquals(1500L, profile.get().getTimeoutMs());
        assertTrue(profile.get().isEnabled());
    }

    @Test
    void shouldReadDisabledFlag() throws Exception {
        try (FileWriter writer = new FileWriter(tempDir.resolve("video.yml").toFile())) {
            writer.write("role: video_creator\n");
            writer.write("enabled: false\n");
        }

        profileService.loadProfiles();

        assertFalse(profileService.getProfile(AgentRole.VIDEO_CREATOR).orElseThrow().isEnabled());
    }

    @Test
    void shouldSkipMalformedProfiles() throws Exception {
        try (FileWriter writer = new FileWriter(tempDir.resolve("broken.yaml").toFile())) {
            writer.write("role: not_a_role\n");
        }
        try (FileWriter writer = new FileWriter(tempDir.resolve("writer.yaml").toFile())) {
            writer.write("role: content_writer\n");
        }

        profileService.loadProfiles();

        assertTrue(profileService.getProfile(AgentRole.CONTENT_WRITER).isPresent());
        assertFalse(profileService.getProfile(AgentRole.SCRIPT_WRITER).isPresent());
    }

    @Test
    void shouldReturnEmptyWhenDirectoryMissing() {
        profileService.setProfilesPath(tempDir.resolve("missing").toString());
        profileService.loadProfiles();

        assertFalse(profileService.getProfile(AgentRole.CONTENT_WRITER).isPresent());
    }
}
