package com.searchcache.search.classifier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SmartQueryFilterTest {

    private final SmartQueryFilter filter = new SmartQueryFilter();

    @ParameterizedTest
    @ValueSource(strings = {"hi", "hello", "thank you", "thanks", "goodbye", "bye", "ok", "yes", "no"})
    void testConversationalFillerSkipsSearch(String query) {
        assertThat(filter.needsEmbeddingSearch(query)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "what properties are available",
            "show me condos in manila",
            "payment plans for townhouse",
            "amenities near the property",
            "location details"
    })
    void testDomainQuestionsNeedSearch(String query) {
        assertThat(filter.needsEmbeddingSearch(query)).isTrue();
    }

    @Test
    void testMatchingIgnoresCaseWhitespaceAndTrailingPunctuation() {
        assertThat(filter.needsEmbeddingSearch("  Thank   You!! ")).isFalse();
        assertThat(filter.needsEmbeddingSearch("OK.")).isFalse();
        assertThat(filter.needsEmbeddingSearch("Hello?")).isFalse();
    }

    @Test
    void testFillerWordInsideQuestionStillSearches() {
        assertThat(filter.needsEmbeddingSearch("hi, what are the payment plans")).isTrue();
        assertThat(filter.needsEmbeddingSearch("is there a yes or no answer on pets")).isTrue();
        assertThat(filter.needsEmbeddingSearch("thanks for the list of condos near makati")).isTrue();
    }

    @Test
    void testBlankInputIsLeftToTheCaller() {
        assertThat(filter.needsEmbeddingSearch("")).isTrue();
        assertThat(filter.needsEmbeddingSearch(null)).isTrue();
    }

    @Test
    void testDefaultResponseForThanks() {
        String response = filter.getDefaultResponse("thank you");

        assertThat(response).isNotBlank();
        assertThat(response.contains("welcome") || response.contains("pleasure")).isTrue();
    }

    @Test
    void testEveryFillerPhraseHasADefaultResponse() {
        for (FillerCategory category : FillerCategory.values()) {
            for (String phrase : category.phrases()) {
                assertThat(filter.needsEmbeddingSearch(phrase)).isFalse();
                assertThat(filter.classify(phrase)).contains(category);
                assertThat(filter.getDefaultResponse(phrase)).isEqualTo(category.defaultResponse()).isNotBlank();
            }
        }
    }

    @Test
    void testGenericResponseForDomainQuestion() {
        assertThat(filter.getDefaultResponse("what properties are available"))
                .isEqualTo(SmartQueryFilter.GENERIC_RESPONSE);
    }
}
