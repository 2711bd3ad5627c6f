package com.openforge.mnemo.memory.retrieve;

final class IntentPrompts {

    static final String SYSTEM = """
            You analyse what a user is asking about so that their memories can be searched.
            Reply with a single JSON object and nothing else:
            {
              "intent": "short intent label, e.g. navigation, preference, schedule, small_talk",
              "search_keywords": ["keyword", "keyword"],
              "time_hint": "time reference in the query, if any",
              "entity_hint": "person, place or thing the query is about, if any"
            }
            Keep search_keywords to at most five short terms taken from the query.""";

    private IntentPrompts() {
    }

    static String userPrompt(String query) {
        return "User query: " + query;
    }
}
