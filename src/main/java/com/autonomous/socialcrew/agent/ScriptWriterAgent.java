package com.autonomous.socialcrew.agent;

import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.TaskType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class ScriptWriterAgent implements AgentCapability {

    @Override
    public AgentRole role() {
        return AgentRole.SCRIPT_WRITER;
    }

    @Override
    public Set<TaskType> acceptedTaskTypes() {
        return Set.of(TaskType.SCRIPT_WRITING);
    }

    @Override
    public Map<String, Object> execute(AgentInvocation invocation) {
        // A script planned together with a video follows the plan's segments
        List<String> segments = new ArrayList<>(List.of("hook", "body", "call_to_action"));
        Object concept = invocation.getPayload().get("topic");
        for (Map<String, Object> plan : invocation.getDependencyResults().values()) {
            if (plan.get("segments") instanceof List<?> planned) {
                segments = planned.stream().map(Object::toString).toList();
            }
            concept = plan.getOrDefault("concept", concept);
        }

        List<Map<String, String>> scenes = new ArrayList<>();
        for (String segment : segments) {
            invocation.checkpoint();
            scenes.add(Map.of("segment", segment, "direction", "Write " + segment + " for " + concept));
            invocation.reportProgress(scenes.size() * 100 / segments.size());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("video_concept", concept);
        result.put("platform", invocation.text("platform"));
        result.put("duration", invocation.text("duration"));
        result.put("scenes", scenes);
        return result;
    }
}
