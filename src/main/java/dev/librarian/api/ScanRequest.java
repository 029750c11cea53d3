package dev.librarian.api;

import jakarta.validation.constraints.NotBlank;

public record ScanRequest(@NotBlank String inputPath, String outputPath) {}
