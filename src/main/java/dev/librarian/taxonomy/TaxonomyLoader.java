package dev.librarian.taxonomy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses and validates the YAML taxonomy definition.
 *
 * <p>Expected shape:
 *
 * <pre>{@code
 * defaults:
 *   misc_workspace: KB.Personal.Misc
 * workspaces:
 *   - id: KB.Finance.Taxes
 *     description: Tax returns, W-2s, 1099s
 *     naming:
 *       prefix: TAX
 *       components: [year, doc_type]
 *       format: "{prefix}-{year}-{doc_type}"
 * }</pre>
 *
 * <p>Validation is all-or-nothing: any problem raises {@link TaxonomyLoadException} so the
 * application refuses to start rather than classify against a partial taxonomy.
 */
public class TaxonomyLoader {

  private static final Logger log = LoggerFactory.getLogger(TaxonomyLoader.class);

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

  /**
   * Reads a taxonomy definition from the given stream.
   *
   * @param input YAML content, closed by the caller
   * @param sourceName label used in error messages and logs
   * @return the validated registry
   * @throws TaxonomyLoadException if the content is unreadable or invalid
   */
  public TaxonomyRegistry load(InputStream input, String sourceName) {
    TaxonomyDefinition definition;
    try {
      definition = yamlMapper.readValue(input, TaxonomyDefinition.class);
    } catch (IOException e) {
      throw new TaxonomyLoadException("Cannot parse taxonomy definition " + sourceName, e);
    }
    if (definition == null || definition.workspaces() == null || definition.workspaces().isEmpty()) {
      throw new TaxonomyLoadException("Taxonomy definition " + sourceName + " has no workspaces");
    }

    List<Workspace> workspaces = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (WorkspaceDefinition entry : definition.workspaces()) {
      Workspace workspace = toWorkspace(entry, sourceName);
      if (!seen.add(workspace.id())) {
        throw new TaxonomyLoadException(
            "Duplicate workspace id '" + workspace.id() + "' in " + sourceName);
      }
      workspaces.add(workspace);
    }

    String miscId =
        definition.defaults() != null && notBlank(definition.defaults().miscWorkspace())
            ? definition.defaults().miscWorkspace()
            : TaxonomyRegistry.DEFAULT_MISC_WORKSPACE;

    TaxonomyRegistry registry = new TaxonomyRegistry(workspaces, miscId);
    log.info("Loaded {} workspaces from {} (misc: {})", registry.size(), sourceName, miscId);
    return registry;
  }

  private static Workspace toWorkspace(WorkspaceDefinition entry, String sourceName) {
    if (entry == null || !notBlank(entry.id())) {
      throw new TaxonomyLoadException("Workspace without id in " + sourceName);
    }
    if (entry.description() == null) {
      throw new TaxonomyLoadException("Workspace '" + entry.id() + "' has no description");
    }
    NamingTemplate naming = entry.naming() == null ? NamingTemplate.DEFAULT : toTemplate(entry);
    return new Workspace(entry.id().trim(), entry.description().trim(), naming);
  }

  private static NamingTemplate toTemplate(WorkspaceDefinition entry) {
    NamingDefinition raw = entry.naming();
    if (!notBlank(raw.prefix())) {
      throw new TaxonomyLoadException("Workspace '" + entry.id() + "' naming has no prefix");
    }
    if (!notBlank(raw.format())) {
      throw new TaxonomyLoadException("Workspace '" + entry.id() + "' naming has no format");
    }
    NamingTemplate template = new NamingTemplate(raw.prefix(), raw.components(), raw.format());

    Set<String> allowed = new HashSet<>(template.components());
    allowed.add("prefix");
    for (String placeholder : template.placeholders()) {
      if (!allowed.contains(placeholder)) {
        throw new TaxonomyLoadException(
            "Workspace '"
                + entry.id()
                + "' format references '{"
                + placeholder
                + "}' which is neither prefix nor a declared component");
      }
    }
    return template;
  }

  private static boolean notBlank(@Nullable String value) {
    return value != null && !value.isBlank();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TaxonomyDefinition(
      @Nullable List<WorkspaceDefinition> workspaces, @Nullable Defaults defaults) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Defaults(@JsonProperty("misc_workspace") @Nullable String miscWorkspace) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record WorkspaceDefinition(
      @Nullable String id, @Nullable String description, @Nullable NamingDefinition naming) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record NamingDefinition(
      @Nullable String prefix, @Nullable List<String> components, @Nullable String format) {}
}
