package dev.librarian.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a free-text model reply into an {@link LlmVerdict}.
 *
 * <p>The first balanced {@code {...}} block is taken as the JSON object; surrounding prose and
 * markdown fences are ignored. {@code workspace} must be a non-blank string and {@code
 * confidence} a number (or a numeric string). Any other shape is reported as empty.
 */
class LlmReplyParser {

  private static final Logger log = LoggerFactory.getLogger(LlmReplyParser.class);

  private final ObjectMapper objectMapper;

  LlmReplyParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  Optional<LlmVerdict> parse(String reply) {
    Optional<String> json = firstJsonObject(reply);
    if (json.isEmpty()) {
      log.debug("No JSON object in model reply");
      return Optional.empty();
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(json.get());
    } catch (JsonProcessingException e) {
      log.debug("Model reply is not valid JSON: {}", e.getOriginalMessage());
      return Optional.empty();
    }
    if (root == null || !root.isObject()) {
      return Optional.empty();
    }

    JsonNode workspace = root.get("workspace");
    if (workspace == null || !workspace.isTextual() || workspace.asText().isBlank()) {
      log.debug("Model reply has no workspace");
      return Optional.empty();
    }
    Optional<Double> confidence = number(root.get("confidence"));
    if (confidence.isEmpty()) {
      log.debug("Model reply has no numeric confidence");
      return Optional.empty();
    }

    return Optional.of(
        new LlmVerdict(
            workspace.asText().trim(),
            normalizeSubpath(text(root.get("subpath"))),
            text(root.get("description")),
            confidence.get(),
            text(root.get("suggested_name"))));
  }

  /** Locates the first balanced JSON object, honouring braces inside string literals. */
  static Optional<String> firstJsonObject(String reply) {
    if (reply == null) {
      return Optional.empty();
    }
    int start = reply.indexOf('{');
    while (start >= 0) {
      int end = matchingBrace(reply, start);
      if (end > start) {
        return Optional.of(reply.substring(start, end + 1));
      }
      start = reply.indexOf('{', start + 1);
    }
    return Optional.empty();
  }

  private static int matchingBrace(String s, int start) {
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < s.length(); i++) {
      char c = s.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private static Optional<Double> number(JsonNode node) {
    if (node == null || node.isNull()) {
      return Optional.empty();
    }
    if (node.isNumber()) {
      return Optional.of(node.asDouble());
    }
    if (node.isTextual()) {
      try {
        return Optional.of(Double.parseDouble(node.asText().trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  private static String text(JsonNode node) {
    if (node == null || node.isNull() || node.isContainerNode()) {
      return "";
    }
    return node.asText().trim();
  }

  static String normalizeSubpath(String subpath) {
    String normalized = subpath.replace('\\', '/').trim();
    while (normalized.startsWith("/")) {
      normalized = normalized.substring(1);
    }
    while (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }
}
