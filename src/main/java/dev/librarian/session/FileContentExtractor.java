package dev.librarian.session;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts the text classification works on.
 *
 * <p>Text-like files are read as UTF-8, replacing malformed input. PDFs go through PDFBox; scanned
 * PDFs without a text layer yield nothing, as there is no OCR. Every other format yields {@code
 * ""}, so its classification relies on the filename and path alone. At most {@code
 * librarian.session.max-text-bytes} bytes are read from a text file, and a PDF's text is cut to
 * the same number of characters.
 */
@Component
public class FileContentExtractor implements ContentExtractor {

  private static final Logger log = LoggerFactory.getLogger(FileContentExtractor.class);

  static final Set<String> TEXT_EXTENSIONS =
      Set.of(
          "txt", "md", "markdown", "csv", "tsv", "json", "xml", "html", "htm", "log", "yaml",
          "yml", "ini", "eml", "rtf");

  static final String PDF_EXTENSION = "pdf";

  private final int maxBytes;

  public FileContentExtractor(SessionProperties properties) {
    this.maxBytes = properties.maxTextBytes();
  }

  @Override
  public String extract(Path file) {
    String extension = extensionOf(file);
    if (TEXT_EXTENSIONS.contains(extension)) {
      return readText(file);
    }
    if (PDF_EXTENSION.equals(extension)) {
      return readPdf(file);
    }
    return "";
  }

  private String readText(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      byte[] bytes = in.readNBytes(maxBytes);
      CharsetDecoder decoder =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPLACE)
              .onUnmappableCharacter(CodingErrorAction.REPLACE);
      return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    } catch (IOException e) {
      log.warn("Could not read text from {}: {}", file, e.getMessage());
      return "";
    }
  }

  private String readPdf(Path file) {
    try (PDDocument document = Loader.loadPDF(file.toFile())) {
      String text = new PDFTextStripper().getText(document);
      return text.length() > maxBytes ? text.substring(0, maxBytes) : text;
    } catch (IOException | RuntimeException e) {
      log.warn("Could not extract PDF text from {}: {}", file, e.toString());
      return "";
    }
  }

  static String extensionOf(Path file) {
    String name = file.getFileName() == null ? "" : file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
