package com.searchcache.search.classifier;

import java.util.Set;

/**
 * Conversational turns that retrieval cannot improve, each with the canned reply sent instead.
 */
public enum FillerCategory {
    GREETING(
            Set.of("hi", "hello", "hey", "hiya", "good morning", "good afternoon", "good evening"),
            "Hello! How can I help you today?"
    ),
    THANKS(
            Set.of("thanks", "thank you", "thanks a lot", "thank you so much", "thx", "ty"),
            "You're welcome! Let me know if there's anything else I can help with."
    ),
    FAREWELL(
            Set.of("bye", "goodbye", "good bye", "see you", "see you later", "take care"),
            "Goodbye! Feel free to come back anytime."
    ),
    ACKNOWLEDGEMENT(
            Set.of("ok", "okay", "k", "cool", "great", "got it", "alright", "noted"),
            "Great! Is there anything else you'd like to know?"
    ),
    AFFIRMATIVE(
            Set.of("yes", "yeah", "yep", "sure"),
            "Sounds good. What would you like to know more about?"
    ),
    NEGATIVE(
            Set.of("no", "nope", "nah"),
            "No problem. Let me know if you need anything else."
    );

    private final Set<String> phrases;
    private final String defaultResponse;

    FillerCategory(Set<String> phrases, String defaultResponse) {
        this.phrases = phrases;
        this.defaultResponse = defaultResponse;
    }

    public Set<String> phrases() {
        return phrases;
    }

    public String defaultResponse() {
        return defaultResponse;
    }
}
