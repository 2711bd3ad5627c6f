package com.openforge.mnemo.memory.manage;

import java.util.List;

/**
 * One page of a listing.
 *
 * @param page  1-based
 * @param total matching items across all pages
 */
public record MemoryPage<T>(List<T> items, long total, int page, int pageSize) {

    public MemoryPage {
        items = List.copyOf(items);
    }

    public int totalPages() {
        return (int) ((total + pageSize - 1) / pageSize);
    }
}
