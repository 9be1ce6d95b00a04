package dev.turbot.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.turbot.fixture.CandidateBuilder;
import dev.turbot.search.EmbeddingException;
import dev.turbot.search.ScoredResult;
import dev.turbot.search.SearchProperties;
import dev.turbot.search.SearchRequest;
import dev.turbot.search.SearchResponse;
import dev.turbot.search.TravelSearchService;
import dev.turbot.search.constraint.Constraint;
import dev.turbot.search.constraint.ConstraintKey;
import dev.turbot.search.constraint.PriceBand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

    @Mock
    TravelSearchService searchService;

    @Mock
    ResultFormatter formatter;

    @Captor
    ArgumentCaptor<SearchRequest> requestCaptor;

    McpToolService toolService;

    @BeforeEach
    void setUp() {
        toolService = new McpToolService(
                searchService, formatter, new SearchProperties(), new ObjectMapper());
    }

    private static SearchResponse responseWith(List<ScoredResult> results) {
        return new SearchResponse("query", results, results.size(), 0.01, null);
    }

    private static ScoredResult aResult() {
        var candidate = new CandidateBuilder().attribute("destination", "Rome").build();
        return new ScoredResult(
                candidate.id(), candidate.body(), candidate.attributes(), 0.8, 0.8, Map.of());
    }

    // --- search_travel ---

    @Test
    void searchTravelParsesConstraintsAndFormatsResults() {
        List<ScoredResult> results = List.of(aResult());
        given(searchService.search(any())).willReturn(responseWith(results));
        given(formatter.format(results)).willReturn("formatted");

        String output = toolService.searchTravel(
                "city break",
                "{\"destination\": \"Rome\", \"price_range\": \"moderate\", \"duration_days\": 5}",
                5,
                0.2);

        assertThat(output).isEqualTo("formatted");
        verify(searchService).search(requestCaptor.capture());
        SearchRequest request = requestCaptor.getValue();
        assertThat(request.query()).isEqualTo("city break");
        assertThat(request.limit()).isEqualTo(5);
        assertThat(request.threshold()).isEqualTo(0.2);
        assertThat(request.constraints().get(ConstraintKey.DESTINATION))
                .contains(new Constraint.Destination("Rome"));
        assertThat(request.constraints().get(ConstraintKey.PRICE_RANGE))
                .contains(new Constraint.PriceRange(PriceBand.MODERATE));
        assertThat(request.constraints().get(ConstraintKey.DURATION_DAYS))
                .contains(new Constraint.DurationDays(5));
    }

    @Test
    void searchTravelAppliesDefaultsWhenOptionalArgumentsAreMissing() {
        given(searchService.search(any())).willReturn(responseWith(List.of(aResult())));
        given(formatter.format(anyList())).willReturn("formatted");

        toolService.searchTravel("beach", null, null, null);

        verify(searchService).search(requestCaptor.capture());
        assertThat(requestCaptor.getValue().limit()).isEqualTo(10);
        assertThat(requestCaptor.getValue().threshold()).isEqualTo(0.1);
        assertThat(requestCaptor.getValue().constraints().isEmpty()).isTrue();
    }

    @Test
    void searchTravelCapsTheLimit() {
        given(searchService.search(any())).willReturn(responseWith(List.of(aResult())));
        given(formatter.format(anyList())).willReturn("formatted");

        toolService.searchTravel("beach", "", 500, null);

        verify(searchService).search(requestCaptor.capture());
        assertThat(requestCaptor.getValue().limit()).isEqualTo(McpToolService.MAX_LIMIT);
    }

    @Test
    void searchTravelIgnoresAmenitiesWithOnlyBlankItems() {
        given(searchService.search(any())).willReturn(responseWith(List.of(aResult())));
        given(formatter.format(anyList())).willReturn("formatted");

        String output =
                toolService.searchTravel("spa weekend", "{\"amenities\": \" , \"}", null, null);

        assertThat(output).isEqualTo("formatted");
        verify(searchService).search(requestCaptor.capture());
        assertThat(requestCaptor.getValue().constraints().isEmpty()).isTrue();
    }

    @Test
    void searchTravelRejectsBlankQuery() {
        String output = toolService.searchTravel("  ", null, null, null);

        assertThat(output).isEqualTo("Error: Query must not be empty. Provide a search query string.");
        verify(searchService, never()).search(any());
    }

    @Test
    void searchTravelWithoutResultsSaysSo() {
        given(searchService.search(any())).willReturn(responseWith(List.of()));

        assertThat(toolService.searchTravel("igloo hotel", null, null, null))
                .isEqualTo("No results found for query: igloo hotel");
    }

    @Test
    void searchTravelWithoutResultsSuggestsRelaxingConstraints() {
        given(searchService.search(any())).willReturn(responseWith(List.of()));

        String output = toolService.searchTravel(
                "igloo hotel", "{\"destination\": \"oslo\"}", null, null);

        assertThat(output)
                .contains("igloo hotel")
                .contains("destination=Oslo")
                .contains("Try relaxing some constraints.");
    }

    @Test
    void searchTravelReportsUnknownConstraint() {
        String output = toolService.searchTravel("rome", "{\"star_rating\": 5}", null, null);

        assertThat(output).startsWith("Error: Invalid search request:").contains("star_rating");
        verify(searchService, never()).search(any());
    }

    @Test
    void searchTravelReportsMalformedConstraintJson() {
        String output = toolService.searchTravel("rome", "destination=Rome", null, null);

        assertThat(output).startsWith("Error: Invalid search request: constraints must be a JSON object");
    }

    @Test
    void searchTravelReportsThresholdOutOfRange() {
        String output = toolService.searchTravel("rome", null, null, 2.0);

        assertThat(output).startsWith("Error: Invalid search request:").contains("threshold");
    }

    @Test
    void searchTravelReportsEmbeddingFailure() {
        given(searchService.search(any()))
                .willThrow(new EmbeddingException("Failed to embed query: boom"));

        assertThat(toolService.searchTravel("rome", null, null, null))
                .startsWith("Error: Search is unavailable")
                .contains("boom");
    }

    @Test
    void searchTravelReportsUnexpectedFailure() {
        given(searchService.search(any())).willThrow(new IllegalStateException("pool closed"));

        assertThat(toolService.searchTravel("rome", null, null, null))
                .isEqualTo("Error searching travel offers: pool closed");
    }

    // --- constraint_vocabulary ---

    @Test
    void constraintVocabularyListsEveryKeyWithItsWeight() {
        String output = toolService.constraintVocabulary();

        for (ConstraintKey key : ConstraintKey.values()) {
            assertThat(output).contains("- " + key.value() + " (weight ");
        }
        assertThat(output).contains("- price_range (weight 0.9)");
        assertThat(output).contains("- amenities (weight 0.1)");
    }

    // --- parseConstraints ---

    @Test
    void parseConstraintsOfBlankInputIsEmpty() {
        assertThat(toolService.parseConstraints(null)).isEmpty();
        assertThat(toolService.parseConstraints(" ")).isEmpty();
    }

    @Test
    void parseConstraintsRejectsJsonArray() {
        assertThatThrownBy(() -> toolService.parseConstraints("[\"rome\"]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("constraints must be a JSON object");
    }
}
