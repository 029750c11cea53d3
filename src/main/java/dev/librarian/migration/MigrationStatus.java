package dev.librarian.migration;

/** Result of migrating a single approved item. */
public enum MigrationStatus {
  /** Copied (or an identical copy was already in place) and the item is now migrated. */
  MIGRATED,
  /** The source file no longer exists or is unreadable; the item stays approved. */
  SOURCE_MISSING,
  /** The destination could not be written; the item stays approved. */
  DESTINATION_ERROR
}
