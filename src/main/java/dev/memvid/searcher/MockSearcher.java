package dev.memvid.searcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic in-memory backend seeded with a small sample resume.
 *
 * <p>Scores start from a fixed base per entry and receive keyword boosts: {@value #TAG_BOOST} per
 * tag contained in the query, {@value #SNIPPET_BOOST} when the query occurs in the snippet and
 * {@value #TITLE_BOOST} when it occurs in the title. Scores are capped at 1.0. No I/O is ever
 * performed and every future is already complete when returned.
 */
public class MockSearcher implements Searcher {

  private static final Logger log = LoggerFactory.getLogger(MockSearcher.class);

  /** The only entity known to {@link #getState}. */
  public static final String PROFILE_ENTITY = "__profile__";

  /** Slot holding the profile JSON. */
  public static final String PROFILE_SLOT = "data";

  static final String MOCK_FILE = "mock://sample-resume.mv2";
  static final int MOCK_FRAME_COUNT = 42;

  static final float TAG_BOOST = 0.05f;
  static final float SNIPPET_BOOST = 0.03f;
  static final float TITLE_BOOST = 0.02f;

  static final List<Entry> DATASET =
      List.of(
          new Entry(
              "Senior Engineering Manager at Northwind Systems",
              0.95f,
              "Led a cross-functional team of 12 engineers building an industrial IoT platform. "
                  + "Introduced CI/CD pipelines that cut deployment time by 60%. "
                  + "Drove adoption of Java 17 and gRPC for latency-critical edge services.",
              List.of("experience", "leadership", "northwind")),
          new Entry(
              "Technical Skills - Programming Languages",
              0.88f,
              "Proficient in Java, Kotlin, Python and TypeScript. "
                  + "Experience with distributed systems, web services and ML pipelines. "
                  + "Strong background in JVM performance tuning and concurrency.",
              List.of("skills", "programming", "languages")),
          new Entry(
              "GenAI and Machine Learning Experience",
              0.92f,
              "Built RAG systems using vector databases and LLM APIs. "
                  + "Implemented semantic search over resume content with memvid indexes. "
                  + "Worked with hosted and open-source language models.",
              List.of("skills", "ai", "ml", "genai")),
          new Entry(
              "Security Engineering Background",
              0.85f,
              "Implemented zero-trust architecture for industrial control systems. "
                  + "Led security audits and penetration testing initiatives. "
                  + "Designed secure communication protocols for edge devices.",
              List.of("experience", "security", "architecture")),
          new Entry(
              "VP Engineering Qualifications",
              0.90f,
              "10+ years of engineering leadership experience. "
                  + "Built and scaled teams from 5 to 50+ engineers. "
                  + "Track record of delivering complex technical projects on time.",
              List.of("leadership", "management", "executive")),
          new Entry(
              "Education - Computer Science",
              0.75f,
              "M.S. Computer Science with a focus on distributed systems. "
                  + "Research in fault-tolerant computing and consensus algorithms. "
                  + "Published papers on edge computing architectures.",
              List.of("education", "academic")));

  static final String PROFILE_JSON =
      """
      {
        "name": "Alex Morgan",
        "title": "Senior Engineering Manager",
        "email": "alex.morgan@example.com",
        "linkedin": "https://linkedin.com/in/alexmorgan",
        "location": "Berlin, Germany",
        "status": "Open to opportunities",
        "suggested_questions": [
          "Tell me about your engineering leadership experience",
          "What's your approach to building high-performing teams?"
        ],
        "tags": ["engineering", "leadership", "platform"],
        "system_prompt": "You are an AI assistant answering questions about Alex's resume.",
        "experience": [
          {"company": "Northwind Systems", "role": "Engineering Manager", "period": "2020-2024"}
        ],
        "skills": {
          "strong": ["Java", "Kotlin"],
          "moderate": ["Python"],
          "gaps": []
        },
        "fit_assessment_examples": []
      }
      """;

  public MockSearcher() {
    log.info("Initializing MockSearcher with {} sample entries", DATASET.size());
  }

  @Override
  public CompletableFuture<SearchResponse> search(String query, int topK, int snippetChars) {
    long startNanos = System.nanoTime();
    try {
      RequestLimits.requireText(query, "Query");
    } catch (SearcherException e) {
      return CompletableFuture.failedFuture(e);
    }

    List<SearchResult> hits =
        rank(
            query,
            DATASET,
            RequestLimits.clampTopK(topK),
            RequestLimits.clampSnippetChars(snippetChars));
    int tookMs = elapsedMs(startNanos);

    log.info("Mock search completed: query='{}', hits={}, tookMs={}", query, hits.size(), tookMs);
    return CompletableFuture.completedFuture(new SearchResponse(hits, hits.size(), tookMs));
  }

  @Override
  public CompletableFuture<AskResponse> ask(AskRequest request) {
    long startNanos = System.nanoTime();
    try {
      RequestLimits.requireText(request.question(), "Question");
    } catch (SearcherException e) {
      return CompletableFuture.failedFuture(e);
    }

    List<Entry> candidates = filterByTags(request.filters());
    List<SearchResult> evidence =
        rank(
            request.question(),
            candidates,
            RequestLimits.clampTopK(request.topK()),
            RequestLimits.clampSnippetChars(request.snippetChars()));
    int tookMs = elapsedMs(startNanos);

    log.info(
        "Mock ask completed: question='{}', mode={}, evidence={}",
        request.question(),
        request.mode(),
        evidence.size());
    AskStats stats = new AskStats(candidates.size(), evidence.size(), tookMs, 0, false);
    return CompletableFuture.completedFuture(
        new AskResponse(AskResponse.contextAnswer(evidence), evidence, stats));
  }

  @Override
  public CompletableFuture<StateResponse> getState(String entity, @Nullable String slot) {
    log.info("Mock get_state called: entity='{}', slot={}", entity, slot);

    if (!PROFILE_ENTITY.equals(entity)) {
      return CompletableFuture.completedFuture(StateResponse.notFound(entity));
    }

    Map<String, String> slots =
        slot == null || PROFILE_SLOT.equals(slot) ? Map.of(PROFILE_SLOT, PROFILE_JSON) : Map.of();
    return CompletableFuture.completedFuture(new StateResponse(true, entity, slots));
  }

  @Override
  public int frameCount() {
    return MOCK_FRAME_COUNT;
  }

  @Override
  public String memvidFile() {
    return MOCK_FILE;
  }

  @Override
  public boolean isReady() {
    return true;
  }

  private List<SearchResult> rank(String query, List<Entry> entries, int topK, int snippetChars) {
    String queryLower = query.toLowerCase(Locale.ROOT);
    List<SearchResult> results = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      results.add(
          new SearchResult(
              entry.title(),
              score(entry, queryLower),
              Snippets.truncate(entry.snippet(), snippetChars),
              entry.tags()));
    }
    // List.sort is stable: equal scores keep dataset order
    results.sort(Comparator.comparingDouble(SearchResult::score).reversed());
    return results.subList(0, Math.min(topK, results.size()));
  }

  static float score(Entry entry, String queryLower) {
    float score = entry.baseScore();
    for (String tag : entry.tags()) {
      if (queryLower.contains(tag)) {
        score += TAG_BOOST;
      }
    }
    if (entry.snippet().toLowerCase(Locale.ROOT).contains(queryLower)) {
      score += SNIPPET_BOOST;
    }
    if (entry.title().toLowerCase(Locale.ROOT).contains(queryLower)) {
      score += TITLE_BOOST;
    }
    return Math.min(score, 1.0f);
  }

  private static List<Entry> filterByTags(Map<String, String> filters) {
    if (filters.isEmpty()) {
      return DATASET;
    }
    return DATASET.stream()
        .filter(entry -> entry.tags().containsAll(filters.values()))
        .toList();
  }

  private static int elapsedMs(long startNanos) {
    return (int) ((System.nanoTime() - startNanos) / 1_000_000);
  }

  /** One seeded dataset entry. */
  record Entry(String title, float baseScore, String snippet, List<String> tags) {}
}
