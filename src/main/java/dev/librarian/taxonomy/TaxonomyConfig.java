package dev.librarian.taxonomy;

import java.io.IOException;
import java.io.InputStream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the taxonomy definition into a singleton {@link TaxonomyRegistry}.
 *
 * <p>A missing or malformed definition fails bean creation, which aborts context startup.
 */
@Configuration
public class TaxonomyConfig {

  @Bean
  public TaxonomyRegistry taxonomyRegistry(
      ResourceLoader resourceLoader,
      @Value("${librarian.taxonomy.location:classpath:taxonomy.yaml}") String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new TaxonomyLoadException("Taxonomy definition not found at " + location);
    }
    try (InputStream input = resource.getInputStream()) {
      return new TaxonomyLoader().load(input, location);
    } catch (IOException e) {
      throw new TaxonomyLoadException("Cannot read taxonomy definition " + location, e);
    }
  }
}
