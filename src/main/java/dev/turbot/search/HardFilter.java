package dev.turbot.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.store.embedding.filter.Filter;
import dev.turbot.search.constraint.ConstraintKey;

/**
 * The single equality predicate pushed down to the candidate store.
 *
 * @param key the constraint the filter was taken from
 * @param value the normalised value candidates must carry under {@link #attributeName()}
 */
public record HardFilter(ConstraintKey key, String value) {

  /** Canonical metadata attribute the filter applies to. */
  public String attributeName() {
    return key.attributeNames().get(0);
  }

  /** Converts the filter into a LangChain4j metadata equality filter. */
  public Filter toStoreFilter() {
    return metadataKey(attributeName()).isEqualTo(value);
  }

  @Override
  public String toString() {
    return attributeName() + "=" + value;
  }
}
