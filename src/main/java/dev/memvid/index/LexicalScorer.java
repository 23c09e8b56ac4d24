package dev.memvid.index;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * BM25 term-frequency scorer over frame title, text, labels and tags.
 *
 * <p>Immutable once built. Scores are unbounded positive doubles; frames sharing no term with the
 * query are left out of the result.
 */
final class LexicalScorer {

  static final double K1 = 1.2;
  static final double B = 0.75;

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

  private final Map<Long, Map<String, Integer>> termFrequencies;
  private final Map<Long, Integer> lengths;
  private final Map<String, Integer> documentFrequencies;
  private final double averageLength;

  LexicalScorer(List<IndexFile.Frame> frames) {
    this.termFrequencies = new LinkedHashMap<>();
    this.lengths = new HashMap<>();
    this.documentFrequencies = new HashMap<>();
    long totalLength = 0;
    for (IndexFile.Frame frame : frames) {
      List<String> tokens = tokenize(document(frame));
      Map<String, Integer> frequencies = new HashMap<>();
      for (String token : tokens) {
        frequencies.merge(token, 1, Integer::sum);
      }
      for (String term : frequencies.keySet()) {
        documentFrequencies.merge(term, 1, Integer::sum);
      }
      termFrequencies.put(frame.id(), frequencies);
      lengths.put(frame.id(), tokens.size());
      totalLength += tokens.size();
    }
    this.averageLength = frames.isEmpty() ? 0.0 : (double) totalLength / frames.size();
  }

  /** Scores every frame sharing at least one term with the query, in frame order. */
  Map<Long, Double> score(String query) {
    Set<String> queryTerms = new LinkedHashSet<>(tokenize(query));
    Map<Long, Double> scores = new LinkedHashMap<>();
    if (queryTerms.isEmpty() || termFrequencies.isEmpty()) {
      return scores;
    }
    int documentCount = termFrequencies.size();
    for (Map.Entry<Long, Map<String, Integer>> entry : termFrequencies.entrySet()) {
      double lengthRatio = averageLength == 0.0 ? 0.0 : lengths.get(entry.getKey()) / averageLength;
      double score = 0.0;
      for (String term : queryTerms) {
        Integer frequency = entry.getValue().get(term);
        if (frequency == null) {
          continue;
        }
        int df = documentFrequencies.get(term);
        double idf = Math.log(1.0 + (documentCount - df + 0.5) / (df + 0.5));
        score += idf * (frequency * (K1 + 1)) / (frequency + K1 * (1 - B + B * lengthRatio));
      }
      if (score > 0.0) {
        scores.put(entry.getKey(), score);
      }
    }
    return scores;
  }

  static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  private static String document(IndexFile.Frame frame) {
    StringBuilder document = new StringBuilder();
    if (frame.title() != null) {
      document.append(frame.title()).append(' ');
    }
    document.append(frame.text());
    frame.labels().forEach(label -> document.append(' ').append(label));
    frame.tags().forEach(tag -> document.append(' ').append(tag));
    return document.toString();
  }
}
