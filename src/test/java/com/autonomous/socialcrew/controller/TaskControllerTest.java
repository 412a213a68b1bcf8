package com.autonomous.socialcrew.controller;

import com.autonomous.socialcrew.exception.AlreadyTerminalException;
import com.autonomous.socialcrew.exception.InvalidRequestException;
import com.autonomous.socialcrew.exception.NoAgentForTypeException;
import com.autonomous.socialcrew.exception.TaskNotFoundException;
import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.AgentStatus;
import com.autonomous.socialcrew.model.ContentRequest;
import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskHandle;
import com.autonomous.socialcrew.model.TaskState;
import com.autonomous.socialcrew.model.TaskType;
import com.autonomous.socialcrew.service.CoordinatorService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CoordinatorService coordinator;

    @Test
    void shouldAcceptContentRequest() throws Exception {
        when(coordinator.submitRequest(any())).thenReturn(new TaskHandle(List.of("t-1"), List.of("t-1")));

        mockMvc.perform(post("/api/requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"type": "content_generation", "owner_id": "alice",
                     "payload": {"platform": "twitter", "topic": "Launch day"}}
                    """))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.root_task_ids[0]").value("t-1"))
            .andExpect(jsonPath("$.task_ids[0]").value("t-1"));

        ArgumentCaptor<ContentRequest> captor = ArgumentCaptor.forClass(ContentRequest.class);
        verify(coordinator).submitRequest(captor.capture());
        assertEquals(TaskType.CONTENT_GENERATION, captor.getValue().getType());
        assertEquals("alice", captor.getValue().getOwnerId());
        assertEquals("Launch day", captor.getValue().getPayload().get("topic"));
    }

    @Test
    void shouldRejectUnknownRequestType() throws Exception {
        mockMvc.perform(post("/api/requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"podcast\", \"owner_id\": \"alice\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));

        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldMapValidationErrorToBadRequest() throws Exception {
        when(coordinator.submitRequest(any())).thenThrow(new InvalidRequestException("topic is required"));

        mockMvc.perform(post("/api/requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"content_generation\", \"owner_id\": \"alice\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("topic is required"));
    }

    @Test
    void shouldMapMissingAgentToServiceUnavailable() throws Exception {
        when(coordinator.submitRequest(any())).thenThrow(new NoAgentForTypeException("No agent accepts task type trend_analysis"));

        mockMvc.perform(post("/api/requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"trend_analysis\", \"owner_id\": \"alice\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("no_agent_for_type"));
    }

    @Test
    void shouldReturnTaskStatus() throws Exception {
        Task task = Task.builder()
            .id("t-1")
            .type(TaskType.VIDEO_PLANNING)
            .ownerId("bob")
            .agentRole(AgentRole.VIDEO_CREATOR)
            .state(TaskState.SUCCEEDED)
            .result(Map.of("hook_window", "0-3 seconds"))
            .build();
        when(coordinator.getStatus("t-1")).thenReturn(task);

        mockMvc.perform(get("/api/tasks/t-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.type").value("video_planning"))
            .andExpect(jsonPath("$.agent_role").value("video_creator"))
            .andExpect(jsonPath("$.state").value("SUCCEEDED"))
            .andExpect(jsonPath("$.result.hook_window").value("0-3 seconds"));
    }

    @Test
    void shouldReturnNotFoundForUnknownTask() throws Exception {
        when(coordinator.getStatus("nope")).thenThrow(new TaskNotFoundException("Task not found: nope"));

        mockMvc.perform(get("/api/tasks/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void shouldListOwnerTasks() throws Exception {
        Task task = Task.builder().id("t-9").ownerId("carol").type(TaskType.TREND_ANALYSIS).state(TaskState.FAILED).build();
        when(coordinator.listTasks("carol", TaskState.FAILED, 5, 0)).thenReturn(List.of(task));

        mockMvc.perform(get("/api/tasks").param("owner", "carol").param("state", "FAILED").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.tasks[0].id").value("t-9"));
    }

    @Test
    void shouldCancelTask() throws Exception {
        when(coordinator.cancel("t-1")).thenReturn(Task.builder().id("t-1").state(TaskState.CANCELLED).build());

        mockMvc.perform(delete("/api/tasks/t-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.task_id").value("t-1"))
            .andExpect(jsonPath("$.state").value("CANCELLED"));
    }

    @Test
    void shouldReportConflictWhenCancellingFinishedTask() throws Exception {
        when(coordinator.cancel("t-1")).thenThrow(new AlreadyTerminalException("t-1", TaskState.SUCCEEDED));

        mockMvc.perform(delete("/api/tasks/t-1"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("already_terminal"))
            .andExpect(jsonPath("$.state").value("SUCCEEDED"));
    }

    @Test
    void shouldRetryTask() throws Exception {
        when(coordinator.retry("t-1")).thenReturn(new TaskHandle(List.of("t-2"), List.of("t-2")));

        mockMvc.perform(post("/api/tasks/t-1/retry"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.task_ids[0]").value("t-2"));
    }

    @Test
    void shouldReportDegradedHealth() throws Exception {
        when(coordinator.listAgentsStatus()).thenReturn(List.of(
            AgentStatus.builder().role(AgentRole.CONTENT_WRITER).healthy(true).build(),
            AgentStatus.builder().role(AgentRole.TRAFFIC_ANALYST).healthy(false).build()));

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("degraded"));
    }

    @Test
    void shouldListAgentStatus() throws Exception {
        when(coordinator.listAgentsStatus()).thenReturn(List.of(
            AgentStatus.builder().role(AgentRole.SCRIPT_WRITER).healthy(true).completedTaskCount(3).build()));

        mockMvc.perform(get("/api/agents/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].role").value("script_writer"))
            .andExpect(jsonPath("$[0].completed_task_count").value(3));
    }
}
