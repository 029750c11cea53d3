package dev.librarian.classification;

/**
 * Workspace suggested by a keyword rule, used to bias or replace the model's answer.
 *
 * @param workspaceId target workspace of the matching rule
 * @param confidenceBoost base boost of the rule, plus one when the path confirms it
 * @param reason human-readable explanation, e.g. {@code "Tax form detected (path confirms)"}
 */
public record HeuristicCandidate(String workspaceId, int confidenceBoost, String reason) {}
