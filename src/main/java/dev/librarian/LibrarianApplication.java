package dev.librarian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Librarian document organizer.
 *
 * <p>Serves the review REST API under {@code /api} and the MCP tools over SSE on port 8080.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LibrarianApplication {

  public static void main(String[] args) {
    SpringApplication.run(LibrarianApplication.class, args);
  }
}
