package dev.librarian.api;

import java.util.List;

/** One page of items, least confident first. */
public record ItemPageResponse(
    List<ItemResponse> items, int page, int size, long totalItems, int totalPages) {}
