package com.openforge.mnemo.memory.extract;

import com.openforge.mnemo.memory.model.ConversationMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Overlapping windows over a message list.
 *
 * Windows start every {@code max(1, size - overlap)} messages and hold up to
 * {@code size} messages; a window with fewer than two messages is not emitted.
 * With size 4, overlap 1 and seven messages the windows start at 0 and 3;
 * the lone message at index 6 is skipped.
 */
public final class ConversationWindows {

    static final int MIN_WINDOW = 2;

    private ConversationWindows() {
    }

    public static List<Window> slice(List<ConversationMessage> messages, int size, int overlap) {
        if (size < 1) throw new IllegalArgumentException("window size must be positive");
        int step = Math.max(1, size - overlap);
        List<Window> windows = new ArrayList<>();
        for (int start = 0; start < messages.size(); start += step) {
            int end = Math.min(messages.size(), start + size);
            if (end - start < MIN_WINDOW) continue;
            windows.add(new Window(start, List.copyOf(messages.subList(start, end))));
        }
        return windows;
    }

    public record Window(int start, List<ConversationMessage> messages) {

        /** One {@code [role] content} line per message. */
        public String transcript() {
            StringBuilder sb = new StringBuilder();
            for (ConversationMessage m : messages) {
                if (!sb.isEmpty()) sb.append('\n');
                sb.append(m.transcriptLine());
            }
            return sb.toString();
        }
    }
}
