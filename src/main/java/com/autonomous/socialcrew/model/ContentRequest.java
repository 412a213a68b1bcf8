package com.autonomous.socialcrew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentRequest {
    private TaskType type;
    private String ownerId;
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();
}
