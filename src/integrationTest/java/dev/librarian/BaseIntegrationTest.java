package dev.librarian;

import dev.librarian.item.DocumentItemRepository;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance, keeps path preferences out of the
 * user's home directory and deletes every stored item before each test.
 */
@SpringBootTest
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  static {
    postgres.start();
  }

  @DynamicPropertySource
  static void sessionProperties(DynamicPropertyRegistry registry) {
    registry.add(
        "librarian.session.preferences-file",
        () -> preferencesDirectory().resolve("preferences.json").toString());
  }

  @Autowired protected DocumentItemRepository documentItemRepository;

  @BeforeEach
  void cleanItems() {
    documentItemRepository.deleteAllInBatch();
  }

  private static Path preferencesDirectory() {
    try {
      return Files.createTempDirectory("librarian-it");
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
