package dev.scriptorium.search;

/** Which keyword matching strategy produced a keyword result list. */
public enum KeywordStrategy {
  /** pg_trgm word similarity, graded scores averaged over keywords. */
  FUZZY,
  /** Case-insensitive substring containment with one flat score. */
  SUBSTRING,
  /** The query had no usable keywords, so nothing was executed. */
  NONE
}
