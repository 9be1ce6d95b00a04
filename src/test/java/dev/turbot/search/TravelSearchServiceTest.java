package dev.turbot.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.turbot.fixture.CandidateBuilder;
import dev.turbot.search.constraint.Constraint;
import dev.turbot.search.constraint.ConstraintKey;
import dev.turbot.search.constraint.ConstraintSet;
import dev.turbot.search.constraint.PriceBand;
import dev.turbot.search.penalty.PenaltyRegistry;
import java.time.Clock;
import java.time.Month;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class TravelSearchServiceTest {

  @Mock EmbeddingModel embeddingModel;

  @Mock CandidateStore candidateStore;

  @Mock Clock clock;

  @Captor ArgumentCaptor<HardFilter> filterCaptor;

  TravelSearchService searchService;

  private static final Embedding DUMMY_EMBEDDING = Embedding.from(new float[] {0.1f, 0.2f, 0.3f});

  @BeforeEach
  void setUp() {
    SearchProperties props = new SearchProperties();
    SoftScoringEngine engine = new SoftScoringEngine(new PenaltyRegistry(), props);
    searchService =
        new TravelSearchService(
            embeddingModel, candidateStore, engine, props, clock, Runnable::run);
  }

  private void stubEmbeddingModel(String query) {
    when(embeddingModel.embed(TravelSearchService.BGE_QUERY_PREFIX + query))
        .thenReturn(Response.from(DUMMY_EMBEDDING));
  }

  private static ConstraintSet romeModerateFiveDays() {
    return ConstraintSet.of(
        new Constraint.Destination("Rome"),
        new Constraint.PriceRange(PriceBand.MODERATE),
        new Constraint.DurationDays(5));
  }

  @Test
  void searchRanksConstraintMatchAboveHigherSimilarityMismatch() {
    stubEmbeddingModel("rome city break");
    when(clock.millis()).thenReturn(1_000L, 1_250L);
    RetrievedCandidate a =
        new CandidateBuilder()
            .id("a")
            .similarity(0.80)
            .attribute("destination", "Rome")
            .attribute("price_range", "moderate")
            .attribute("duration_days", "5")
            .build();
    RetrievedCandidate b =
        new CandidateBuilder()
            .id("b")
            .similarity(0.85)
            .attribute("destination", "Rome")
            .attribute("price_range", "luxury")
            .attribute("duration_days", "5")
            .build();
    when(candidateStore.query(eq(DUMMY_EMBEDDING), anyInt(), any())).thenReturn(List.of(b, a));

    SearchResponse response =
        searchService.search(new SearchRequest("rome city break", romeModerateFiveDays()));

    assertThat(response.results()).extracting(ScoredResult::id).containsExactly("a");
    assertThat(response.results().get(0).score()).isEqualTo(0.80);
    assertThat(response.totalResults()).isEqualTo(1);
    assertThat(response.processingTime()).isEqualTo(0.25);
    assertThat(response.hardFilter()).isEqualTo(new HardFilter(ConstraintKey.DESTINATION, "Rome"));
  }

  @Test
  void lowThresholdKeepsPenalisedCandidateBelowTheMatch() {
    stubEmbeddingModel("rome");
    when(clock.millis()).thenReturn(0L);
    RetrievedCandidate a =
        new CandidateBuilder()
            .id("a")
            .similarity(0.80)
            .attribute("price_range", "moderate")
            .attribute("duration_days", 5)
            .build();
    RetrievedCandidate b =
        new CandidateBuilder()
            .id("b")
            .similarity(0.85)
            .attribute("price_range", "luxury")
            .attribute("duration_days", 5)
            .build();
    when(candidateStore.query(any(), anyInt(), any())).thenReturn(List.of(b, a));

    SearchResponse response =
        searchService.search(new SearchRequest("rome", romeModerateFiveDays(), 10, 0.0));

    assertThat(response.results()).extracting(ScoredResult::id).containsExactly("a", "b");
    assertThat(response.results().get(1).score())
        .isCloseTo(0.085, within(1e-9));
  }

  @Test
  void storeIsQueriedWithOverFetchedSizeAndSelectedFilter() {
    stubEmbeddingModel("summer trip");
    when(clock.millis()).thenReturn(0L);
    when(candidateStore.query(any(), anyInt(), any())).thenReturn(List.of());
    ConstraintSet constraints =
        ConstraintSet.of(
            new Constraint.Category("Tour"), new Constraint.TravelMonth(Month.JULY));

    searchService.search(new SearchRequest("summer trip", constraints, 4, 0.1));

    verify(candidateStore).query(eq(DUMMY_EMBEDDING), eq(12), filterCaptor.capture());
    assertThat(filterCaptor.getValue())
        .isEqualTo(new HardFilter(ConstraintKey.TRAVEL_MONTH, "july"));
  }

  @Test
  void searchWithoutFilterableConstraintQueriesUnfiltered() {
    stubEmbeddingModel("anything");
    when(clock.millis()).thenReturn(0L);
    when(candidateStore.query(any(), anyInt(), isNull())).thenReturn(List.of());

    SearchResponse response =
        searchService.search(
            new SearchRequest("anything", ConstraintSet.of(new Constraint.DurationDays(3))));

    verify(candidateStore).query(eq(DUMMY_EMBEDDING), eq(30), isNull());
    assertThat(response.hardFilter()).isNull();
  }

  @Test
  void hugeLimitSaturatesFetchSizeInsteadOfOverflowing() {
    stubEmbeddingModel("rome");
    when(clock.millis()).thenReturn(0L);
    when(candidateStore.query(any(), anyInt(), any()))
        .thenReturn(List.of(new CandidateBuilder().id("only").similarity(0.6).build()));

    SearchResponse response =
        searchService.search(new SearchRequest("rome", ConstraintSet.empty(), 1_000_000_000, 0.0));

    verify(candidateStore).query(eq(DUMMY_EMBEDDING), eq(Integer.MAX_VALUE), isNull());
    assertThat(response.totalResults()).isEqualTo(1);
  }

  @Test
  void storeFailureYieldsEmptyResponse() {
    stubEmbeddingModel("rome");
    when(clock.millis()).thenReturn(0L);
    when(candidateStore.query(any(), anyInt(), any()))
        .thenThrow(new IllegalStateException("connection refused"));

    SearchResponse response = searchService.search(new SearchRequest("rome"));

    assertThat(response.results()).isEmpty();
    assertThat(response.totalResults()).isZero();
    assertThat(response.query()).isEqualTo("rome");
  }

  @Test
  void embeddingFailurePropagatesAsEmbeddingException() {
    when(clock.millis()).thenReturn(0L);
    when(embeddingModel.embed(any(String.class)))
        .thenThrow(new RuntimeException("model not loaded"));

    assertThatThrownBy(() -> searchService.search(new SearchRequest("rome")))
        .isInstanceOf(EmbeddingException.class)
        .hasMessageContaining("model not loaded");
    verify(candidateStore, never()).query(any(), anyInt(), any());
  }

  @Test
  void queryIsEmbeddedWithBgePrefix() {
    stubEmbeddingModel("lake district");
    when(clock.millis()).thenReturn(0L);
    when(candidateStore.query(any(), anyInt(), any())).thenReturn(List.of());

    searchService.search(new SearchRequest("lake district"));

    verify(embeddingModel)
        .embed("Represent this sentence for searching relevant passages: lake district");
  }

  @Test
  void searchAsyncCompletesWithTheSameResponse() {
    stubEmbeddingModel("rome");
    when(clock.millis()).thenReturn(0L);
    when(candidateStore.query(any(), anyInt(), any()))
        .thenReturn(List.of(new CandidateBuilder().id("only").similarity(0.6).build()));

    SearchResponse response = searchService.searchAsync(new SearchRequest("rome")).join();

    assertThat(response.results()).extracting(ScoredResult::id).containsExactly("only");
  }
}
