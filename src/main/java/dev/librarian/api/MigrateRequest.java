package dev.librarian.api;

public record MigrateRequest(String outputPath) {}
