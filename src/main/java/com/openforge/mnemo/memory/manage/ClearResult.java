package com.openforge.mnemo.memory.manage;

public record ClearResult(String userId, int episodicDeleted, int semanticDeleted) {}
