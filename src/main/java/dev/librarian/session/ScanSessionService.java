package dev.librarian.session;

import dev.librarian.item.ItemLifecycleService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds the current {@link ScanSession}.
 *
 * <p>A scan replaces the previous session and discards every stored item, so each review works
 * on exactly one directory. The session lives in memory; the scanned paths are also remembered
 * through {@link PathPreferencesStore} for the next start.
 */
@Service
public class ScanSessionService {

  private static final Logger log = LoggerFactory.getLogger(ScanSessionService.class);

  /** Output folder created next to the input directory when none is given. */
  public static final String DEFAULT_OUTPUT_FOLDER = "organized_folder";

  private final AtomicReference<ScanSession> current = new AtomicReference<>();
  private final DirectoryScanner scanner;
  private final ItemLifecycleService lifecycleService;
  private final PathPreferencesStore preferencesStore;
  private final ClassificationProgressTracker progressTracker;
  private final Clock clock;

  public ScanSessionService(
      DirectoryScanner scanner,
      ItemLifecycleService lifecycleService,
      PathPreferencesStore preferencesStore,
      ClassificationProgressTracker progressTracker,
      Clock clock) {
    this.scanner = scanner;
    this.lifecycleService = lifecycleService;
    this.preferencesStore = preferencesStore;
    this.progressTracker = progressTracker;
    this.clock = clock;
  }

  /**
   * Starts a new session on {@code inputPath}.
   *
   * @param inputPath directory to review
   * @param outputPath root of the organized tree, defaults to {@value #DEFAULT_OUTPUT_FOLDER}
   *     next to the input directory
   * @throws IllegalArgumentException if the input is not a readable directory or equals the
   *     output
   * @throws IllegalStateException while a classification run is in progress
   */
  public ScanSession scan(String inputPath, @Nullable String outputPath) {
    if (inputPath == null || inputPath.isBlank()) {
      throw new IllegalArgumentException("Input path must not be empty");
    }
    Path input = Path.of(inputPath.strip()).toAbsolutePath().normalize();
    if (!Files.exists(input)) {
      throw new IllegalArgumentException("Input path does not exist: " + input);
    }
    if (!Files.isDirectory(input)) {
      throw new IllegalArgumentException("Input path must be a directory: " + input);
    }
    Path output = resolveOutput(input, outputPath);
    if (progressTracker.current().isRunning()) {
      throw new IllegalStateException("Classification in progress, wait for it to finish");
    }

    List<Path> files;
    try {
      files = scanner.scan(input);
    } catch (IOException e) {
      throw new IllegalArgumentException("Cannot read input directory " + input, e);
    }
    // an output tree nested in the input must not be reclassified
    files = files.stream().filter(f -> !f.startsWith(output)).toList();

    lifecycleService.clearAll();
    progressTracker.reset();
    ScanSession session = new ScanSession(input, output, files, clock.instant());
    current.set(session);
    preferencesStore.save(new PathPreferences(input.toString(), output.toString()));
    log.info("Scanned {}: {} files, output {}", input, files.size(), output);
    return session;
  }

  public Optional<ScanSession> current() {
    return Optional.ofNullable(current.get());
  }

  /**
   * Ends the session: forgets the scanned directory, drops any run in flight and deletes every
   * item.
   *
   * @return number of items deleted
   */
  public long clear() {
    current.set(null);
    progressTracker.reset();
    return lifecycleService.clearAll();
  }

  public PathPreferences lastPaths() {
    return preferencesStore.load();
  }

  /**
   * Stores the given paths, keeping the remembered value for any path left out.
   *
   * @return true if the preferences were written
   */
  public boolean rememberPaths(@Nullable String inputPath, @Nullable String outputPath) {
    PathPreferences previous = preferencesStore.load();
    return preferencesStore.save(
        new PathPreferences(
            inputPath != null ? inputPath : previous.lastInputPath(),
            outputPath != null ? outputPath : previous.lastOutputPath()));
  }

  private static Path resolveOutput(Path input, @Nullable String outputPath) {
    if (outputPath != null && !outputPath.isBlank()) {
      Path output = Path.of(outputPath.strip()).toAbsolutePath().normalize();
      if (output.equals(input)) {
        throw new IllegalArgumentException("Output path must differ from the input path");
      }
      return output;
    }
    Path parent = input.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(
          "Output path is required when scanning a filesystem root");
    }
    return parent.resolve(DEFAULT_OUTPUT_FOLDER);
  }
}
