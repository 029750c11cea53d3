package dev.librarian.taxonomy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-workspace rule describing how a destination filename is assembled.
 *
 * <p>{@code format} references {@code {prefix}} and the tokens listed in {@code components}, e.g.
 * {@code "{prefix}-{year}-{doc_type}"}.
 *
 * @param prefix short uppercase code prepended to every filename of the workspace
 * @param components ordered component tokens resolved by the filename generator
 * @param format template string with {@code {token}} placeholders
 */
public record NamingTemplate(String prefix, List<String> components, String format) {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]*)}");

  /** Template applied to workspaces whose definition carries no naming block. */
  public static final NamingTemplate DEFAULT =
      new NamingTemplate("DOC", List.of("doc_type"), "{prefix}-{doc_type}");

  public NamingTemplate {
    components = components == null ? List.of() : List.copyOf(components);
  }

  /**
   * Lists the placeholder names referenced by {@link #format()}, in order of first appearance.
   *
   * @return placeholder names without braces
   */
  public Set<String> placeholders() {
    Set<String> names = new LinkedHashSet<>();
    if (format == null) {
      return names;
    }
    Matcher matcher = PLACEHOLDER.matcher(format);
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
    return names;
  }
}
