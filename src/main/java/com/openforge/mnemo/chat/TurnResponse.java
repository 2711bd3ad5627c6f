package com.openforge.mnemo.chat;

import com.openforge.mnemo.memory.model.RetrievalResult;

/**
 * @param memoryContext        what retrieval produced; null when memory was off or retrieval failed
 * @param extractionTriggered  whether a background extraction was scheduled by this turn
 */
public record TurnResponse(
        String          reply,
        String          sessionId,
        int             memoriesUsed,
        RetrievalResult memoryContext,
        boolean         extractionTriggered
) {}
