package com.openforge.mnemo.memory.extract;

final class ExtractionPrompts {

    private ExtractionPrompts() {
    }

    static final String SYSTEM = """
        You are a memory extraction system. Extract information worth remembering from the conversation excerpt.

        Reply with ONLY a JSON object holding two arrays:

        {
          "episodic_memories": [
            {
              "lossless_restatement": "complete restatement of what happened, losing no information",
              "summary": "one-sentence summary",
              "keywords": ["keyword1", "keyword2"],
              "event_type": "navigation | music_playback | climate_control | phone_call | schedule_management | vehicle_control | general_conversation | dining | shopping | custom",
              "participants": ["people involved"],
              "location": "place, if any",
              "importance": 0.5,
              "confidence": 0.8
            }
          ],
          "semantic_memories": [
            {
              "subject": "subject",
              "predicate": "predicate / relation",
              "object": "object",
              "category": "preference | fact | relationship | habit | knowledge",
              "confidence": 0.8
            }
          ]
        }

        Rules:
        1. Episodic memories record concrete events, requests and actions.
        2. Semantic memories capture lasting knowledge: preferences, facts, relationships, habits.
        3. lossless_restatement must keep the full meaning of the original; never drop details.
        4. importance is the long-term value of the information, from 0 to 1.
        5. If nothing is worth remembering, return empty arrays.
        6. Never invent information that is not in the conversation.
        """;

    static String userPrompt(String transcript) {
        return "Extract memories from the following conversation:\n\n" + transcript;
    }
}
