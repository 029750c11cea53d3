package dev.librarian.session;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * The directory currently under review and where approved files will be migrated to.
 *
 * @param inputRoot scanned directory
 * @param outputRoot root of the organized tree
 * @param files regular files found under the input root, sorted
 * @param startedAt when the scan ran
 */
public record ScanSession(Path inputRoot, Path outputRoot, List<Path> files, Instant startedAt) {

  public ScanSession {
    files = List.copyOf(files);
  }

  public int fileCount() {
    return files.size();
  }
}
