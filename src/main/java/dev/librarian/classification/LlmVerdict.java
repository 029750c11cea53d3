package dev.librarian.classification;

/**
 * Schema-checked but not yet reconciled model reply.
 *
 * @param workspace workspace id as written by the model, possibly unknown
 * @param subpath normalized subfolder, empty when absent
 * @param description description, empty when absent
 * @param confidence raw numeric confidence, not yet clamped
 * @param suggestedName suggested name, empty when absent
 */
record LlmVerdict(
    String workspace, String subpath, String description, double confidence, String suggestedName) {}
