package dev.librarian.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryScannerTest {

  @TempDir Path root;

  private final DirectoryScanner scanner = new DirectoryScanner();

  @Test
  void listsRegularFilesRecursivelyInSortedOrder() throws IOException {
    Files.createDirectories(root.resolve("b/c"));
    Files.writeString(root.resolve("b/c/deep.txt"), "x");
    Files.writeString(root.resolve("z.pdf"), "x");
    Files.writeString(root.resolve("a.pdf"), "x");

    assertThat(scanner.scan(root))
        .containsExactly(
            root.resolve("a.pdf"), root.resolve("b/c/deep.txt"), root.resolve("z.pdf"));
  }

  @Test
  void skipsHiddenFilesAndDirectories() throws IOException {
    Files.createDirectories(root.resolve(".git"));
    Files.writeString(root.resolve(".git/config"), "x");
    Files.writeString(root.resolve(".DS_Store"), "x");
    Files.writeString(root.resolve("visible.txt"), "x");

    assertThat(scanner.scan(root)).containsExactly(root.resolve("visible.txt"));
  }

  @Test
  void missingRootFails() {
    assertThatThrownBy(() -> scanner.scan(root.resolve("missing")))
        .isInstanceOf(NoSuchFileException.class);
  }
}
