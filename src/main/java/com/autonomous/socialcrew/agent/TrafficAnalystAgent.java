package com.autonomous.socialcrew.agent;

import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.TaskType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class TrafficAnalystAgent implements AgentCapability {

    @Override
    public AgentRole role() {
        return AgentRole.TRAFFIC_ANALYST;
    }

    @Override
    public Set<TaskType> acceptedTaskTypes() {
        return Set.of(TaskType.TREND_ANALYSIS);
    }

    @Override
    public Map<String, Object> execute(AgentInvocation invocation) {
        List<?> platforms = (List<?>) invocation.getPayload().get("platforms");
        List<?> keywords = (List<?>) invocation.getPayload().get("keywords");

        Map<String, Object> tracked = new LinkedHashMap<>();
        for (Object platform : platforms) {
            invocation.checkpoint();
            tracked.put(platform.toString(), keywords.stream().map(Object::toString).toList());
            invocation.reportProgress(tracked.size() * 100 / platforms.size());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("timeframe", invocation.getPayload().getOrDefault("timeframe", "24h"));
        result.put("tracked_keywords", tracked);
        result.put("competitor_accounts", invocation.getPayload().getOrDefault("competitor_accounts", List.of()));
        return result;
    }
}
