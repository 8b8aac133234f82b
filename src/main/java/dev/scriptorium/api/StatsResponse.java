package dev.scriptorium.api;

/** Corpus counts returned by {@code GET /api/stats}. */
public record StatsResponse(
    long documents, long chunks, long embeddedChunks, int embeddingDimension) {}
