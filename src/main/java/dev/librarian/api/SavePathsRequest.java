package dev.librarian.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/** Paths to remember for the next session. A missing path keeps its stored value. */
public record SavePathsRequest(
    @JsonProperty("input_path") @Nullable String inputPath,
    @JsonProperty("output_path") @Nullable String outputPath) {}
