package com.autonomous.socialcrew.model;

import com.autonomous.socialcrew.exception.InvalidRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskTypeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldResolveWireNames() {
        assertEquals(TaskType.VIDEO_PLANNING, TaskType.fromWireName("video_planning"));
        assertEquals(TaskType.TREND_ANALYSIS, TaskType.fromWireName("TREND_ANALYSIS"));
    }

    @Test
    void shouldRejectUnknownType() {
        assertThrows(InvalidRequestException.class, () -> TaskType.fromWireName("podcast_editing"));
    }

    @Test
    void shouldSerializeAsWireName() throws Exception {
        assertEquals("\"script_writing\"", mapper.writeValueAsString(TaskType.SCRIPT_WRITING));
        assertEquals(TaskType.CONTENT_GENERATION, mapper.readValue("\"content_generation\"", TaskType.class));
    }
}
