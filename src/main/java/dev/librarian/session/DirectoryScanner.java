package dev.librarian.session;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lists the regular files below a directory in a stable order.
 *
 * <p>Hidden files and directories (name starting with {@code .}) are skipped, as are
 * unreadable subdirectories.
 */
@Component
public class DirectoryScanner {

  private static final Logger log = LoggerFactory.getLogger(DirectoryScanner.class);

  /**
   * @param root directory to walk
   * @return absolute, normalized file paths sorted lexicographically
   * @throws IOException if {@code root} itself cannot be read
   */
  public List<Path> scan(Path root) throws IOException {
    Path start = root.toAbsolutePath().normalize();
    List<Path> files = new ArrayList<>();
    Files.walkFileTree(
        start,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(start) && isHidden(dir)) {
              return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && !isHidden(file)) {
              files.add(file);
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(start)) {
              throw exc;
            }
            log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
          }
        });
    files.sort(null);
    return files;
  }

  private static boolean isHidden(Path path) {
    Path name = path.getFileName();
    return name != null && name.toString().startsWith(".");
  }
}
