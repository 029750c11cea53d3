package dev.librarian.api;

public record ItemUpdateRequest(
    String proposedWorkspace, String proposedSubpath, String proposedFilename, String status) {}
