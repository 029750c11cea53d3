package dev.librarian.files;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.springframework.stereotype.Component;

/**
 * Copy and move primitives for placing files in the organized tree.
 *
 * <p>Neither operation overwrites an existing target; callers decide what an existing target
 * means. Parent directories of the target are created as needed.
 */
@Component
public class FileTransfer {

  /**
   * Copies {@code source} to {@code target}, preserving timestamps and attributes.
   *
   * @throws NoSuchFileException if the source does not exist
   * @throws java.nio.file.FileAlreadyExistsException if the target exists
   * @throws IOException on any other I/O failure
   */
  public void copy(Path source, Path target) throws IOException {
    requireRegularFile(source);
    createParents(target);
    Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
  }

  /**
   * Moves {@code source} to {@code target}.
   *
   * @throws NoSuchFileException if the source does not exist
   * @throws java.nio.file.FileAlreadyExistsException if the target exists
   * @throws IOException on any other I/O failure
   */
  public void move(Path source, Path target) throws IOException {
    requireRegularFile(source);
    createParents(target);
    Files.move(source, target);
  }

  public boolean exists(Path path) {
    return Files.exists(path);
  }

  /**
   * First path of the form {@code name}, {@code name_1}, {@code name_2}, ... (before the
   * extension) that does not exist yet.
   */
  public Path firstFreeName(Path target) {
    if (!Files.exists(target)) {
      return target;
    }
    String fileName = target.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String base = dot > 0 ? fileName.substring(0, dot) : fileName;
    String extension = dot > 0 ? fileName.substring(dot) : "";
    for (int i = 1; ; i++) {
      Path candidate = target.resolveSibling(base + "_" + i + extension);
      if (!Files.exists(candidate)) {
        return candidate;
      }
    }
  }

  private static void requireRegularFile(Path source) throws IOException {
    if (!Files.isRegularFile(source)) {
      throw new NoSuchFileException(source.toString(), null, "source file missing");
    }
  }

  private static void createParents(Path target) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }
}
