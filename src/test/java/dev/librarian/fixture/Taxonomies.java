package dev.librarian.fixture;

import dev.librarian.taxonomy.TaxonomyLoader;
import dev.librarian.taxonomy.TaxonomyRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/** Loads the bundled {@code taxonomy.yaml} once for unit tests. */
public final class Taxonomies {

  private static TaxonomyRegistry standard;

  private Taxonomies() {}

  public static synchronized TaxonomyRegistry standard() {
    if (standard == null) {
      try (InputStream in = Taxonomies.class.getResourceAsStream("/taxonomy.yaml")) {
        if (in == null) {
          throw new IllegalStateException("taxonomy.yaml not on the test classpath");
        }
        standard = new TaxonomyLoader().load(in, "taxonomy.yaml");
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return standard;
  }
}
