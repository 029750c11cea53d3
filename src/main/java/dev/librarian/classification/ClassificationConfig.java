package dev.librarian.classification;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.librarian.llm.LanguageModelBackend;
import dev.librarian.taxonomy.TaxonomyRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the classification pipeline around the configured language model backend. */
@Configuration
public class ClassificationConfig {

  @Bean
  public HeuristicMatcher heuristicMatcher() {
    return new HeuristicMatcher(HeuristicRules.defaults());
  }

  @Bean
  public LlmClassifier llmClassifier(
      LanguageModelBackend backend,
      TaxonomyRegistry taxonomy,
      ObjectMapper objectMapper,
      ClassificationProperties properties) {
    return new LlmClassifier(backend, taxonomy, objectMapper, properties.getExcerptChars());
  }

  @Bean
  public ClassificationEngine classificationEngine(
      PathHintExtractor pathHintExtractor,
      MetadataExtractor metadataExtractor,
      HeuristicMatcher heuristicMatcher,
      LlmClassifier llmClassifier,
      FilenameGenerator filenameGenerator,
      TaxonomyRegistry taxonomy) {
    return new ClassificationEngine(
        pathHintExtractor,
        metadataExtractor,
        heuristicMatcher,
        llmClassifier,
        filenameGenerator,
        taxonomy);
  }
}
