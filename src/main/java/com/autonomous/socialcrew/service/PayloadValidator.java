package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.exception.InvalidRequestException;
import com.autonomous.socialcrew.model.TaskType;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shape checks for request payloads, one rule set per task type.
 */
final class PayloadValidator {

    static final Set<String> PLATFORMS = Set.of("twitter", "linkedin", "instagram", "facebook", "tiktok", "youtube");
    static final Set<String> CONTENT_TYPES = Set.of("post", "thread", "story", "reel", "video", "carousel", "article");
    static final Set<String> TIMEFRAMES = Set.of("1h", "24h", "7d", "30d");

    private PayloadValidator() {
    }

    static void validate(TaskType type, Map<String, Object> payload) {
        switch (type) {
            case CONTENT_GENERATION -> {
                requirePlatform(payload, "platform");
                requireText(payload, "topic", 3, 200);
                requireText(payload, "brand_voice", 3, 100);
                requireText(payload, "target_audience", 3, 200);
                optionalOneOf(payload, "content_type", CONTENT_TYPES);
                optionalList(payload, "keywords", 0, 20);
            }
            case TREND_ANALYSIS -> {
                List<?> platforms = requireList(payload, "platforms", 1, PLATFORMS.size());
                for (Object platform : platforms) {
                    if (platform == null || !PLATFORMS.contains(platform.toString())) {
                        throw new InvalidRequestException("Unknown platform in platforms: " + platform);
                    }
                }
                requireList(payload, "keywords", 1, 50);
                optionalOneOf(payload, "timeframe", TIMEFRAMES);
                optionalList(payload, "competitor_accounts", 0, Integer.MAX_VALUE);
            }
            case VIDEO_PLANNING -> {
                requireText(payload, "topic", 3, 200);
                requirePlatform(payload, "platform");
                requireText(payload, "duration", 1, 20);
                requireText(payload, "style", 1, 100);
                requireText(payload, "target_audience", 3, 200);
                Object includeScript = payload.get("include_script");
                if (includeScript != null && !(includeScript instanceof Boolean)) {
                    throw new InvalidRequestException("include_script must be a boolean");
                }
            }
            case SCRIPT_WRITING -> {
                requireText(payload, "topic", 3, 200);
                requirePlatform(payload, "platform");
                requireText(payload, "duration", 1, 20);
            }
        }
    }

    private static String requireText(Map<String, Object> payload, String field, int min, int max) {
        Object value = payload.get(field);
        if (!(value instanceof String)) {
            throw new InvalidRequestException(field + " is required");
        }
        String text = ((String) value).trim();
        if (text.length() < min || text.length() > max) {
            throw new InvalidRequestException(String.format("%s must be %d-%d characters", field, min, max));
        }
        return text;
    }

    private static void requirePlatform(Map<String, Object> payload, String field) {
        String platform = requireText(payload, field, 1, 20);
        if (!PLATFORMS.contains(platform)) {
            throw new InvalidRequestException("Unknown platform: " + platform);
        }
    }

    private static List<?> requireList(Map<String, Object> payload, String field, int min, int max) {
        Object value = payload.get(field);
        if (!(value instanceof List)) {
            throw new InvalidRequestException(field + " must be a list");
        }
        List<?> list = (List<?>) value;
        if (list.size() < min || list.size() > max) {
            throw new InvalidRequestException(String.format("%s must have %d-%d entries", field, min, max));
        }
        return list;
    }

    private static void optionalList(Map<String, Object> payload, String field, int min, int max) {
        if (payload.get(field) != null) {
            requireList(payload, field, min, max);
        }
    }

    private static void optionalOneOf(Map<String, Object> payload, String field, Set<String> allowed) {
        Object value = payload.get(field);
        if (value != null && !allowed.contains(value.toString())) {
            throw new InvalidRequestException(String.format("%s must be one of %s", field, allowed));
        }
    }
}
