package com.searchcache.search.classifier;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a query is worth an embedding call and similarity search. Only an exact match
 * against the filler phrases of {@link FillerCategory} is skipped, so "thanks, what are the payment
 * plans" still searches.
 */
@Component
public class SmartQueryFilter {

    static final String GENERIC_RESPONSE = "I'm here to help. Could you tell me a bit more about what you're looking for?";

    private static final Map<String, FillerCategory> PHRASE_INDEX = buildIndex();

    public boolean needsEmbeddingSearch(String query) {
        return classify(query).isEmpty();
    }

    public String getDefaultResponse(String query) {
        return classify(query)
                .map(FillerCategory::defaultResponse)
                .orElse(GENERIC_RESPONSE);
    }

    public Optional<FillerCategory> classify(String query) {
        String normalized = normalize(query);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(PHRASE_INDEX.get(normalized));
    }

    static String normalize(String query) {
        if (query == null) {
            return "";
        }
        String text = query.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return text.replaceAll("[\\s!.?,]+$", "");
    }

    private static Map<String, FillerCategory> buildIndex() {
        Map<String, FillerCategory> index = new HashMap<>();
        for (FillerCategory category : FillerCategory.values()) {
            for (String phrase : category.phrases()) {
                index.put(phrase, category);
            }
        }
        return Map.copyOf(index);
    }
}
