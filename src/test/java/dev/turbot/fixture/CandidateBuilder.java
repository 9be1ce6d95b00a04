package dev.turbot.fixture;

import dev.turbot.search.CandidateAttributes;
import dev.turbot.search.RetrievedCandidate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight test builder for {@link RetrievedCandidate}.
 * Provides sensible defaults so tests only override what they care about.
 *
 * <pre>{@code
 * RetrievedCandidate rome = new CandidateBuilder()
 *     .attribute("destination", "Rome")
 *     .similarity(0.8)
 *     .build();
 * }</pre>
 */
public final class CandidateBuilder {

    private String id = "fragment-1";
    private String body = "Seven days in the Eternal City with guided tours and a hotel near Termini.";
    private double similarity = 0.75;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public CandidateBuilder() {
        attributes.put(CandidateAttributes.SOURCE_FILE, "offers-2025.pdf");
    }

    public CandidateBuilder id(String id) {
        this.id = id;
        return this;
    }

    public CandidateBuilder body(String body) {
        this.body = body;
        return this;
    }

    public CandidateBuilder similarity(double similarity) {
        this.similarity = similarity;
        return this;
    }

    public CandidateBuilder attribute(String name, Object value) {
        attributes.put(name, value);
        return this;
    }

    public CandidateAttributes attributes() {
        return new CandidateAttributes(attributes);
    }

    public RetrievedCandidate build() {
        return new RetrievedCandidate(id, body, attributes(), similarity);
    }
}
