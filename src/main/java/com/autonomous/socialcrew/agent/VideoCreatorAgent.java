package com.autonomous.socialcrew.agent;

import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.TaskType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plans the structure of a video. The script writer builds on the plan this produces.
 */
@Component
public class VideoCreatorAgent implements AgentCapability {

    @Override
    public AgentRole role() {
        return AgentRole.VIDEO_CREATOR;
    }

    @Override
    public Set<TaskType> acceptedTaskTypes() {
        return Set.of(TaskType.VIDEO_PLANNING);
    }

    @Override
    public Map<String, Object> execute(AgentInvocation invocation) {
        String platform = invocation.text("platform");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("concept", String.format("%s (%s, %s)",
            invocation.text("topic"), invocation.text("style"), invocation.getPayload().getOrDefault("video_type", "educational")));
        result.put("platform", platform);
        result.put("duration", invocation.text("duration"));
        result.put("hook_window", "tiktok".equals(platform) ? "0-3 seconds" : "0-5 seconds");
        result.put("segments", List.of("hook", "introduction", "main_content", "call_to_action"));
        result.put("audience", invocation.text("target_audience"));
        return result;
    }
}
