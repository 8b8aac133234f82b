package dev.scriptorium.search;

/** The two retrieval channels of hybrid search. */
public enum SearchChannel {
  VECTOR,
  KEYWORD
}
