package dev.librarian.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Last used input and output paths. Empty strings when never set. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PathPreferences(
    @JsonProperty("last_input_path") String lastInputPath,
    @JsonProperty("last_output_path") String lastOutputPath) {

  public PathPreferences {
    lastInputPath = lastInputPath == null ? "" : lastInputPath;
    lastOutputPath = lastOutputPath == null ? "" : lastOutputPath;
  }

  public static PathPreferences empty() {
    return new PathPreferences("", "");
  }
}
