package com.searchcache.search.invalidation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.searchcache.search.service.SearchOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Drops a tenant's cached result lists when one of its documents is uploaded, updated or removed,
 * so the next search ranks against the new corpus.
 */
@Component
@ConditionalOnProperty(name = "search.invalidation.kafka.enabled", havingValue = "true")
public class DocumentEventListener {

    private static final Logger log = LoggerFactory.getLogger(DocumentEventListener.class);

    private final SearchOrchestrator searchOrchestrator;
    private final ObjectMapper mapper;

    public DocumentEventListener(SearchOrchestrator searchOrchestrator, ObjectMapper mapper) {
        this.searchOrchestrator = searchOrchestrator;
        this.mapper = mapper;
    }

    @KafkaListener(
            topics = "${search.invalidation.topic:document-events}",
            groupId = "${spring.kafka.consumer.group-id:search-cache-invalidation}"
    )
    public void consume(String message) {
        String tenantId;
        try {
            tenantId = extractTenantId(mapper.readTree(message));
        } catch (IOException ex) {
            log.warn("event=document_event_skipped reason=malformed cause={}", ex.getMessage());
            return;
        }
        if (tenantId == null) {
            log.warn("event=document_event_skipped reason=missing_tenant");
            return;
        }
        searchOrchestrator.invalidateTenant(tenantId);
    }

    private static String extractTenantId(JsonNode node) {
        for (String field : new String[]{"agentId", "tenantId", "agent_id"}) {
            String value = node.path(field).asText("");
            if (!value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
