package dev.turbot.search;

import dev.langchain4j.data.document.Metadata;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Structured attributes attached to a stored document fragment, keyed by metadata name.
 *
 * <p>Every attribute is optional. Values are kept exactly as the store returned them (strings,
 * numbers) and only interpreted when a constraint is scored against them. A blank string counts as
 * absent, since fragments are written with empty strings for unknown fields.
 *
 * @param values raw metadata values by attribute name
 */
public record CandidateAttributes(Map<String, Object> values) {

  /** Metadata key holding the identifier of the document the fragment was cut from. */
  public static final String SOURCE_FILE = "source_file";

  public CandidateAttributes {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static CandidateAttributes empty() {
    return new CandidateAttributes(Map.of());
  }

  public static CandidateAttributes from(Metadata metadata) {
    return new CandidateAttributes(metadata.toMap());
  }

  /** Returns the value stored under {@code name}, or null when missing or blank. */
  public @Nullable Object get(String name) {
    Object value = values.get(name);
    if (value instanceof String s && s.isBlank()) {
      return null;
    }
    return value;
  }

  /** Returns the first present value among {@code names}, or null when none is present. */
  public @Nullable Object firstPresent(List<String> names) {
    for (String name : names) {
      Object value = get(name);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** Source document identifier, or an empty string when the fragment carries none. */
  public String sourceFile() {
    Object value = get(SOURCE_FILE);
    return value != null ? value.toString() : "";
  }
}
