package dev.scriptorium.api;

import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/ingest}; every field is optional.
 *
 * @param documentsPath folder to scan, null for the configured folder
 * @param cleanExisting reset the corpus first, null for the configured default
 */
public record IngestApiRequest(@Nullable String documentsPath, @Nullable Boolean cleanExisting) {}
