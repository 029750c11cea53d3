package dev.librarian.taxonomy;

/**
 * A taxonomy category a document can be filed under, identified by a dotted path such as {@code
 * KB.Finance.Taxes}.
 *
 * @param id globally unique dotted identifier
 * @param description human description, embedded in classification prompts
 * @param naming filename template for documents filed here
 */
public record Workspace(String id, String description, NamingTemplate naming) {

  public Workspace {
    naming = naming == null ? NamingTemplate.DEFAULT : naming;
  }
}
