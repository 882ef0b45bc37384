package com.ai.studyengine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Expected reply for a topic proposal:
 *
 * <pre>
 * {"title": "...", "categories": [{"title", "description", "subtopics": [...], "prerequisites": [...]}]}
 * </pre>
 *
 * Only field presence and types are checked here; structural quality is
 * the hierarchy validator's job.
 */
@Component
public class TopicProposalSchema implements ResponseSchema<TopicProposal> {

    @Override
    public String name() {
        return "topic-proposal";
    }

    @Override
    public TopicProposal validate(JsonNode root) throws SchemaViolationException {
        JsonNode categories = root.get("categories");
        if (categories == null || !categories.isArray() || categories.isEmpty()) {
            throw new SchemaViolationException("'categories' must be a non-empty array");
        }

        List<TopicProposal.Node> nodes = new ArrayList<>();
        for (JsonNode category : categories) {
            nodes.add(toNode(category, "categories"));
        }
        JsonNode title = root.get("title");
        return TopicProposal.builder()
                .title(title != null && title.isTextual() && !title.asText().isBlank() ? title.asText().strip() : null)
                .categories(nodes)
                .build();
    }

    private TopicProposal.Node toNode(JsonNode json, String path) throws SchemaViolationException {
        if (!json.isObject()) {
            throw new SchemaViolationException(path + ": topic must be an object");
        }
        JsonNode title = json.get("title");
        if (title == null || !title.isTextual() || title.asText().isBlank()) {
            throw new SchemaViolationException(path + ": topic title must be a non-empty string");
        }
        String here = path + "/" + title.asText().strip();

        JsonNode description = json.get("description");
        if (description != null && !description.isNull() && !description.isTextual()) {
            throw new SchemaViolationException(here + ": description must be a string");
        }

        List<TopicProposal.Node> children = new ArrayList<>();
        JsonNode subtopics = json.get("subtopics");
        if (subtopics != null && !subtopics.isNull()) {
            if (!subtopics.isArray()) {
                throw new SchemaViolationException(here + ": subtopics must be an array");
            }
            for (JsonNode child : subtopics) {
                children.add(toNode(child, here));
            }
        }

        List<String> prerequisites = new ArrayList<>();
        JsonNode prereqs = json.get("prerequisites");
        if (prereqs != null && !prereqs.isNull()) {
            if (!prereqs.isArray()) {
                throw new SchemaViolationException(here + ": prerequisites must be an array");
            }
            for (JsonNode p : prereqs) {
                if (!p.isTextual()) {
                    throw new SchemaViolationException(here + ": prerequisites must be strings");
                }
                if (!p.asText().isBlank())
                    prerequisites.add(p.asText().strip());
            }
        }

        return TopicProposal.Node.builder()
                .title(title.asText().strip())
                .description(description != null && description.isTextual() ? description.asText().strip() : null)
                .subtopics(children)
                .prerequisites(prerequisites)
                .build();
    }
}
