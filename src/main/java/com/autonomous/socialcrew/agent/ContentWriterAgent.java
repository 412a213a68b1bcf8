package com.autonomous.socialcrew.agent;

import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.TaskType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drafts a platform-aware post brief. Stands in for the LLM-backed writer.
 */
@Component
public class ContentWriterAgent implements AgentCapability {

    private static final Map<String, Integer> CHARACTER_LIMITS = Map.of(
        "twitter", 280,
        "linkedin", 3000,
        "instagram", 2200,
        "facebook", 63206,
        "tiktok", 2200,
        "youtube", 5000
    );

    @Override
    public AgentRole role() {
        return AgentRole.CONTENT_WRITER;
    }

    @Override
    public Set<TaskType> acceptedTaskTypes() {
        return Set.of(TaskType.CONTENT_GENERATION);
    }

    @Override
    public Map<String, Object> execute(AgentInvocation invocation) {
        String platform = invocation.text("platform");
        String topic = invocation.text("topic");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("platform", platform);
        result.put("content_type", invocation.getPayload().getOrDefault("content_type", "post"));
        result.put("headline", String.format("%s, in a %s voice", topic, invocation.text("brand_voice")));
        result.put("audience", invocation.text("target_audience"));
        result.put("character_limit", CHARACTER_LIMITS.getOrDefault(platform, 2200));
        result.put("hashtags", hashtags(topic, invocation.getPayload().get("keywords")));
        return result;
    }

    private List<String> hashtags(String topic, Object keywords) {
        List<String> tags = new ArrayList<>();
        tags.add("#" + topic.replaceAll("[^A-Za-z0-9]", ""));
        if (keywords instanceof List<?> list) {
            for (Object keyword : list) {
                tags.add("#" + keyword.toString().replaceAll("[^A-Za-z0-9]", ""));
            }
        }
        return tags;
    }
}
