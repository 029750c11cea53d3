package dev.librarian.taxonomy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only index of the workspace taxonomy.
 *
 * <p>Built once by {@link TaxonomyLoader} at startup and shared by every classification in the
 * process. Declaration order is preserved by {@link #all()}, since prompts list workspaces in that
 * order. One workspace is reserved as the Misc bucket that unknown ids are remapped to.
 */
public class TaxonomyRegistry {

  /** Misc workspace used when the definition does not name one. */
  public static final String DEFAULT_MISC_WORKSPACE = "KB.Personal.Misc";

  private final Map<String, Workspace> workspaces;
  private final Workspace misc;

  /**
   * Creates a registry over already-validated workspaces.
   *
   * @param workspaces workspaces in declaration order, ids unique
   * @param miscWorkspaceId id of the reserved Misc workspace, must be among {@code workspaces}
   * @throws TaxonomyLoadException if ids collide or the Misc workspace is missing
   */
  public TaxonomyRegistry(List<Workspace> workspaces, String miscWorkspaceId) {
    Map<String, Workspace> index = new LinkedHashMap<>();
    for (Workspace workspace : workspaces) {
      if (index.putIfAbsent(workspace.id(), workspace) != null) {
        throw new TaxonomyLoadException("Duplicate workspace id: " + workspace.id());
      }
    }
    Workspace miscWorkspace = index.get(miscWorkspaceId);
    if (miscWorkspace == null) {
      throw new TaxonomyLoadException(
          "Misc workspace '" + miscWorkspaceId + "' is not defined in the taxonomy");
    }
    this.workspaces = Collections.unmodifiableMap(index);
    this.misc = miscWorkspace;
  }

  public Optional<Workspace> resolve(String workspaceId) {
    if (workspaceId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(workspaces.get(workspaceId));
  }

  public boolean contains(String workspaceId) {
    return workspaceId != null && workspaces.containsKey(workspaceId);
  }

  /** All workspaces in declaration order. */
  public List<Workspace> all() {
    return List.copyOf(workspaces.values());
  }

  public Workspace misc() {
    return misc;
  }

  public int size() {
    return workspaces.size();
  }
}
