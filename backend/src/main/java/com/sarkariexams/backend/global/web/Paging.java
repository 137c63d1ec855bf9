package com.sarkariexams.backend.global.web;

import org.springframework.data.domain.PageRequest;

public final class Paging {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    private Paging() {
    }

    public static PageRequest of(Integer limit, Integer offset) {
        int safeLimit = limit == null ? DEFAULT_LIMIT : Math.min(Math.max(limit, 1), MAX_LIMIT);
        int safeOffset = offset == null ? 0 : Math.max(offset, 0);
        // offsets round down to the enclosing page
        return PageRequest.of(safeOffset / safeLimit, safeLimit);
    }
}
