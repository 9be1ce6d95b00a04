package dev.turbot.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.turbot.search.EmbeddingException;
import dev.turbot.search.SearchProperties;
import dev.turbot.search.SearchRequest;
import dev.turbot.search.SearchResponse;
import dev.turbot.search.TravelSearchService;
import dev.turbot.search.constraint.ConstraintKey;
import dev.turbot.search.constraint.ConstraintSet;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing travel search as tool methods for the response-generation layer.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Functional tools: {@code search_travel}, {@code constraint_vocabulary}.
 *
 * @see ResultFormatter
 */
@Service
public class McpToolService {

  private static final TypeReference<Map<String, Object>> CONSTRAINT_MAP = new TypeReference<>() {};

  /** Upper bound on results a single tool call may request. */
  static final int MAX_LIMIT = 50;

  private final TravelSearchService searchService;
  private final ResultFormatter formatter;
  private final SearchProperties properties;
  private final ObjectMapper objectMapper;

  public McpToolService(
      TravelSearchService searchService,
      ResultFormatter formatter,
      SearchProperties properties,
      ObjectMapper objectMapper) {
    this.searchService = searchService;
    this.formatter = formatter;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * Searches travel offers by semantic query, ranking results against the structured constraints
   * extracted from the user's request.
   */
  @Tool(
      name = "search_travel",
      description =
          "Search travel offers by semantic query. Constraints such as destination, price range, "
              + "travel month, duration, category, transport and family-friendliness narrow and "
              + "rank the results. Returns excerpts with source documents and scores.")
  public String searchTravel(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(
              description =
                  "JSON object of constraints, e.g. {\"destination\": \"Rome\", "
                      + "\"price_range\": \"moderate\", \"duration_days\": 5}",
              required = false)
          @Nullable String constraints,
      @ToolParam(description = "Maximum number of results (1-50, default 10)", required = false)
          @Nullable Integer limit,
      @ToolParam(
              description = "Minimum result score (0.0-1.0, default 0.1)",
              required = false)
          @Nullable Double threshold) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      ConstraintSet constraintSet = ConstraintSet.fromRaw(parseConstraints(constraints));
      SearchRequest request =
          new SearchRequest(
              query,
              constraintSet,
              clampLimit(limit),
              threshold != null ? threshold : properties.getDefaultThreshold());

      SearchResponse response = searchService.search(request);
      if (response.results().isEmpty()) {
        return buildEmptyResultMessage(query, constraintSet);
      }
      return formatter.format(response.results());
    } catch (EmbeddingException e) {
      return "Error: Search is unavailable, the query could not be embedded: " + e.getMessage();
    } catch (IllegalArgumentException e) {
      return "Error: Invalid search request: " + e.getMessage();
    } catch (Exception e) {
      return "Error searching travel offers: " + e.getMessage();
    }
  }

  /** Lists the constraint names the search understands with their penalty weights. */
  @Tool(
      name = "constraint_vocabulary",
      description =
          "List the constraint names accepted by search_travel and how strongly a mismatch on "
              + "each one lowers a result's score.")
  public String constraintVocabulary() {
    StringBuilder sb = new StringBuilder("Constraints (weight = maximum score loss on mismatch):\n");
    for (ConstraintKey key : ConstraintKey.values()) {
      sb.append(
          String.format(
              Locale.ROOT, "- %s (weight %.1f)%n", key.value(), properties.weightFor(key.value())));
    }
    return sb.toString();
  }

  Map<String, Object> parseConstraints(@Nullable String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, CONSTRAINT_MAP);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "constraints must be a JSON object: " + e.getOriginalMessage(), e);
    }
  }

  private int clampLimit(@Nullable Integer limit) {
    if (limit == null || limit < 1) {
      return properties.getDefaultLimit();
    }
    return Math.min(limit, MAX_LIMIT);
  }

  private String buildEmptyResultMessage(String query, ConstraintSet constraints) {
    if (constraints.isEmpty()) {
      return "No results found for query: " + query;
    }
    return "No results for query '%s' with constraints [%s]. Try relaxing some constraints."
        .formatted(query, constraints.describe());
  }
}
