package com.example.cloudinvestigator.query;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns executor error text into a short remediation note that is fed
 * back into later planning prompts.
 */
@Component
public class LessonGenerator {

    static final String DEFAULT_LESSON = "Query failed - need to improve schema understanding";

    private static final Map<String, String> LESSONS = new LinkedHashMap<>();

    static {
        LESSONS.put("column \"state\"", "Use 'instance_state' instead of 'state' for EC2 instance queries");
        LESSONS.put("column \"running\"", "Use 'instance_state = \"running\"' instead of 'running' column");
        LESSONS.put("group_id", "Use JSONB operators for security group fields: sg->>'GroupId'");
    }

    public String lessonFor(String errorMessage) {
        if (errorMessage != null) {
            for (Map.Entry<String, String> entry : LESSONS.entrySet()) {
                if (errorMessage.contains(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        return DEFAULT_LESSON;
    }
}
