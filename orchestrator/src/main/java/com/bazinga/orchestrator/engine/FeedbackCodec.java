package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.worker.IssueReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * JSON codec for the issue set stored on a task group between dispatches
 * (task_groups.feedback_json).
 */
@Component
public class FeedbackCodec {

    private static final TypeReference<List<IssueReport>> ISSUE_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public FeedbackCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(List<IssueReport> issues) {
        if (issues == null || issues.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(issues);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode feedback", e);
        }
    }

    public List<IssueReport> decode(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, ISSUE_LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored feedback is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
