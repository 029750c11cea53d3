package dev.librarian.classification;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PathHintExtractorTest {

  private final PathHintExtractor extractor = new PathHintExtractor();

  @Test
  void extractsKeywordsAndYearsFromDirectoriesAndStem() {
    PathHints hints =
        extractor.extract("/home/me/Documents/Taxes/2023/W2_2023.pdf", "W2_2023.pdf");

    assertThat(hints.keywords()).contains("home", "documents", "taxes", "2023", "w2_2023");
    assertThat(hints.years()).containsExactly("2023");
    assertThat(hints.context()).isEqualTo("home me documents taxes 2023 w2_2023");
  }

  @Test
  void punctuationSplitsWords() {
    PathHints hints = extractor.extract("/scan/Real-Estate (Main St)/deed.pdf", "deed.pdf");

    assertThat(hints.keywords()).contains("real", "estate", "main", "st", "deed");
  }

  @Test
  void acceptsWindowsSeparators() {
    PathHints hints = extractor.extract("C:\\Users\\me\\Insurance\\policy.pdf", "policy.pdf");

    assertThat(hints.keywords()).contains("insurance", "policy");
    assertThat(hints.context()).contains("insurance");
  }

  @Test
  void onlyWholeFourDigitYearsCount() {
    PathHints hints = extractor.extract("/archive/20245/1999-2001/scan.pdf", "scan.pdf");

    assertThat(hints.years()).containsExactly("1999", "2001");
  }

  @Test
  void blankPathYieldsEmptyHints() {
    assertThat(extractor.extract("", "file.pdf")).isEqualTo(PathHints.empty());
    assertThat(extractor.extract(null, "file.pdf").hasContext()).isFalse();
  }

  @Test
  void stemDropsOnlyLastExtension() {
    assertThat(PathHintExtractor.stem("archive.tar.gz")).isEqualTo("archive.tar");
    assertThat(PathHintExtractor.stem(".hidden")).isEqualTo(".hidden");
  }
}
