package com.searchcache.search.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String model;
    private final int maxBatchSize;

    public OllamaEmbeddingProvider(RestTemplate restTemplate, String baseUrl, String model, int maxBatchSize) {
        this(restTemplate, new ObjectMapper(), baseUrl, model, maxBatchSize);
    }

    @Autowired
    public OllamaEmbeddingProvider(
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            @Value("${search.embedding.base-url:http://ollama:11434}") String baseUrl,
            @Value("${search.embedding.model:embeddinggemma}") String model,
            @Value("${search.embedding.max-batch-size:100}") int maxBatchSize
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.model = model;
        this.maxBatchSize = Math.max(1, maxBatchSize);
    }

    @Override
    public List<float[]> embed(List<String> queries) throws IOException {
        if (queries.isEmpty()) {
            return List.of();
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        payload.put("input", queries);

        String response = restTemplate.postForObject(baseUrl + "/api/embed", payload, String.class);
        if (response == null || response.isBlank()) {
            throw new IOException("Empty response from embedding provider");
        }

        JsonNode embeddingsNode = objectMapper.readTree(response).path("embeddings");
        if (!embeddingsNode.isArray()) {
            throw new IOException("Embedding provider response has no embeddings array");
        }
        List<float[]> vectors = new ArrayList<>(embeddingsNode.size());
        for (JsonNode embeddingNode : embeddingsNode) {
            vectors.add(toVector(embeddingNode));
        }
        return vectors;
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    private static float[] toVector(JsonNode embeddingNode) throws IOException {
        if (!embeddingNode.isArray() || embeddingNode.isEmpty()) {
            throw new IOException("Embedding provider returned an empty vector");
        }
        float[] vector = new float[embeddingNode.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = embeddingNode.get(i);
            if (!value.isNumber()) {
                throw new IOException("Non-numeric embedding component at index " + i);
            }
            vector[i] = (float) value.asDouble();
        }
        return vector;
    }
}
