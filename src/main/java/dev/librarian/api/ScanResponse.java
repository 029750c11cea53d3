package dev.librarian.api;

import java.util.List;

/** Scan summary; at most the first 100 files are listed. */
public record ScanResponse(
    String inputPath, String outputPath, int fileCount, List<FileEntry> files) {

  public record FileEntry(String path, String name) {}
}
