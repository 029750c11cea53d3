package dev.librarian.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Remembers the last scanned input path and output path in a small JSON file.
 *
 * <p>Preferences are a convenience: a missing or corrupt file reads as empty and a failed write
 * is logged, neither fails the scan.
 */
@Component
public class PathPreferencesStore {

  private static final Logger log = LoggerFactory.getLogger(PathPreferencesStore.class);

  private final ObjectMapper objectMapper;
  private final Path file;

  @Autowired
  public PathPreferencesStore(ObjectMapper objectMapper, SessionProperties properties) {
    this(objectMapper, Path.of(properties.preferencesFile()));
  }

  PathPreferencesStore(ObjectMapper objectMapper, Path file) {
    this.objectMapper = objectMapper;
    this.file = file;
  }

  public PathPreferences load() {
    if (!Files.isRegularFile(file)) {
      return PathPreferences.empty();
    }
    try {
      return objectMapper.readValue(file.toFile(), PathPreferences.class);
    } catch (IOException e) {
      log.warn("Ignoring unreadable preferences file {}: {}", file, e.getMessage());
      return PathPreferences.empty();
    }
  }

  /**
   * Stores the paths.
   *
   * @return true if the file was written
   */
  public boolean save(PathPreferences preferences) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), preferences);
      return true;
    } catch (IOException e) {
      log.warn("Could not save preferences to {}: {}", file, e.getMessage());
      return false;
    }
  }
}
