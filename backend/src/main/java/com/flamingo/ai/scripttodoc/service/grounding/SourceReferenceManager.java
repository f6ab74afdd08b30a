package com.flamingo.ai.scripttodoc.service.grounding;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.service.grounding.similarity.SimilarityScorer;
import com.flamingo.ai.scripttodoc.service.step.GeneratedStep;
import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds the evidence behind generated steps and turns it into a confidence score. Steps whose
 * wording cannot be traced back to the transcript score low and fail {@link #validateStep}, which
 * is how fabricated steps are caught.
 *
 * <p>This service is stateless. Everything tied to one document lives in the {@link
 * GroundingSession} returned by {@link #openSession}.
 */
@Service
@Slf4j
public class SourceReferenceManager {

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
          "is", "are", "was", "were", "be", "been", "have", "has", "had", "do", "does", "did",
          "will", "would", "should", "could");

  private static final String STRIP_CHARS = ".,!?;:()[]{}\"'";

  private static final List<String> BOOST_VERBS =
      List.of(
          "click", "open", "navigate", "select", "choose", "enter", "type", "create", "delete",
          "update", "configure", "set", "go");

  private static final List<String> UI_ACTION_VERBS =
      List.of(
          "click", "open", "navigate", "select", "choose", "enter", "type", "create", "delete",
          "update", "configure", "set");

  private static final Map<String, Pattern> VERB_PATTERNS =
      Stream.concat(BOOST_VERBS.stream(), UI_ACTION_VERBS.stream())
          .distinct()
          .collect(
              Collectors.toUnmodifiableMap(
                  Function.identity(), v -> Pattern.compile("\\b" + v + "\\b")));

  private static final Pattern ARTICLES = Pattern.compile("\\b(?:the|a|an)\\b\\s*");

  private static final double ACTION_BOOST = 0.1;
  private static final double TECHNICAL_FLOOR = 0.10;
  private static final double PHRASE_STEP = 0.2;
  private static final double MAX_PHRASE_SCORE = 0.6;
  private static final int KNOWLEDGE_CHAR_LIMIT = 2000;
  private static final int KNOWLEDGE_EXCERPT_LENGTH = 300;
  private static final double UI_ELEMENT_CONFIDENCE = 0.8;

  private final PipelineConfig.Grounding config;
  private final SimilarityScorer similarityScorer;
  private final MeterRegistry meterRegistry;

  private final double wordWeight;
  private final double keywordWeight;
  private final double phraseWeight;
  private final double semanticWeight;
  private final double characterWeight;

  public SourceReferenceManager(
      PipelineConfig pipelineConfig,
      SimilarityScorer similarityScorer,
      MeterRegistry meterRegistry) {
    this.config = pipelineConfig.getGrounding();
    this.config.validate();
    this.similarityScorer = similarityScorer;
    this.meterRegistry = meterRegistry;

    double sum = config.weightSum();
    double scale = 1.0;
    if (Math.abs(sum - 1.0) > 0.01) {
      log.warn("Matching weights sum to {}, normalizing", String.format("%.2f", sum));
      scale = 1.0 / sum;
    }
    this.wordWeight = config.getWordOverlapWeight() * scale;
    this.keywordWeight = config.getKeywordWeight() * scale;
    this.phraseWeight = config.getPhraseWeight() * scale;
    this.semanticWeight = config.getSemanticWeight() * scale;
    this.characterWeight = config.getCharacterWeight() * scale;
    if (!similarityScorer.isSemantic() && semanticWeight > 0) {
      log.info("No semantic scorer configured, semantic similarity scores 0");
    }

    log.info(
        "Grounding weights: word={}, keyword={}, phrase={}, semantic={}, char={}",
        String.format("%.2f", wordWeight),
        String.format("%.2f", keywordWeight),
        String.format("%.2f", phraseWeight),
        String.format("%.2f", semanticWeight),
        String.format("%.2f", characterWeight));
  }

  private boolean usesSemanticScorer() {
    return semanticWeight > 0 && similarityScorer.isSemantic();
  }

  /**
   * Opens a grounding session over a transcript's sentences.
   *
   * @param sentences the sentence catalog steps will be matched against
   * @return a fresh session with its own caches and citation counts
   */
  public GroundingSession openSession(List<ParsedSentence> sentences) {
    List<String> passages = sentences.stream().map(ParsedSentence::text).toList();
    SimilarityScorer scorer =
        usesSemanticScorer() ? similarityScorer.forSession(passages) : similarityScorer;
    log.debug("Opened grounding session over {} sentences", sentences.size());
    return new GroundingSession(sentences, scorer);
  }

  /**
   * Gathers evidence for a step, scores it and records it in the session.
   *
   * @param session grounding session of the transcript
   * @param stepIndex position of the step
   * @param step the generated step
   * @param screenshots optional screenshots, may be empty
   * @param knowledgeSources optional reference material, may be empty
   * @return evidence with confidence and validation flags set
   */
  public StepSourceData buildStepSources(
      GroundingSession session,
      int stepIndex,
      GeneratedStep step,
      List<ScreenshotEvidence> screenshots,
      List<KnowledgeSource> knowledgeSources) {
    List<SourceReference> sources = new ArrayList<>(findTranscriptSources(session, step));
    if (screenshots != null && !screenshots.isEmpty()) {
      sources.addAll(findVisualSources(step, screenshots));
    }
    if (knowledgeSources != null && !knowledgeSources.isEmpty()) {
      sources.addAll(findKnowledgeSources(step, knowledgeSources));
    }

    StepSourceData data = new StepSourceData(stepIndex, step.content(), sources);
    data.setOverallConfidence(calculateConfidence(data));
    StepGroundingVerdict verdict = validateStep(data);
    session.record(data);

    meterRegistry.counter("grounding.steps.built").increment();
    log.info(
        "Step {}: confidence {}, {} sources, grounded: {}",
        stepIndex,
        String.format("%.2f", data.getOverallConfidence()),
        sources.size(),
        verdict.valid());
    return data;
  }

  /**
   * Finds transcript sentences that support a step. Each returned sentence is counted as cited
   * so later steps reusing it score lower.
   *
   * @param session grounding session of the transcript
   * @param step the generated step
   * @return up to the configured number of transcript sources, strongest first
   */
  public List<SourceReference> findTranscriptSources(GroundingSession session, GeneratedStep step) {
    String searchText = searchText(step);
    String searchLower = searchText.toLowerCase(Locale.ROOT);
    Set<String> queryWords = significantWords(searchLower, true);
    if (queryWords.isEmpty()) {
      return List.of();
    }
    List<String> keyWords = queryWords.stream().filter(w -> w.length() > 4).toList();
    List<String> phrases = adjacentPhrases(queryWords);
    Set<String> stepVerbs = stepVerbs(step.actions());

    List<SourceReference> candidates = new ArrayList<>();
    List<ParsedSentence> catalog = session.getCatalog();
    for (int position = 0; position < catalog.size(); position++) {
      ParsedSentence sentence = catalog.get(position);
      String sentenceLower = sentence.text().toLowerCase(Locale.ROOT);
      Set<String> sentenceWords = significantWords(sentenceLower, false);

      Set<String> shared = new HashSet<>(queryWords);
      shared.retainAll(sentenceWords);
      if (shared.size() < config.getMinSharedWords()) {
        continue;
      }

      Set<String> union = new HashSet<>(queryWords);
      union.addAll(sentenceWords);
      double wordOverlap = (double) shared.size() / union.size();

      double keywordScore = 0.0;
      if (!keyWords.isEmpty()) {
        long hits = keyWords.stream().filter(sentenceLower::contains).count();
        keywordScore = (double) hits / keyWords.size();
      }

      double phraseScore = 0.0;
      if (!keyWords.isEmpty()) {
        for (String phrase : phrases) {
          if (sentenceLower.contains(phrase)) {
            phraseScore += PHRASE_STEP;
          }
        }
        phraseScore = Math.min(phraseScore, MAX_PHRASE_SCORE);
      }

      double semanticScore =
          usesSemanticScorer()
              ? session.similarityScorer().score(searchText, sentence.text())
              : 0.0;
      double charSimilarity =
          characterWeight > 0 ? SequenceSimilarity.ratio(searchLower, sentenceLower) : 0.0;

      double score =
          wordOverlap * wordWeight
              + keywordScore * keywordWeight
              + phraseScore * phraseWeight
              + semanticScore * semanticWeight
              + charSimilarity * characterWeight;

      for (String verb : stepVerbs) {
        if (containsWord(sentenceLower, verb)) {
          score += ACTION_BOOST;
          break;
        }
      }

      score *= 1.0 - reusePenalty(session.citationCount(sentence.sentenceIndex()));

      if (score >= TECHNICAL_FLOOR) {
        score += session.technicalScore(position) * config.getTechnicalBoost();
      }
      score = Math.min(score, 1.0);

      if (score >= config.getMinTranscriptScore()) {
        candidates.add(
            SourceReference.transcript(
                sentence.text(), sentence.sentenceIndex(), sentence.timestamp(), score));
      }
    }

    List<SourceReference> top = topN(candidates, config.getMaxTranscriptSources());
    for (SourceReference source : top) {
      session.recordCitation(source.sentenceIndex());
    }
    meterRegistry.counter("grounding.sources.found", "type", "transcript").increment(top.size());
    return top;
  }

  /**
   * Finds reference documents that support a step.
   *
   * @param step the generated step
   * @param knowledgeSources fetched reference material
   * @return up to the configured number of knowledge sources, strongest first
   */
  public List<SourceReference> findKnowledgeSources(
      GeneratedStep step, List<KnowledgeSource> knowledgeSources) {
    String searchLower = searchText(step).toLowerCase(Locale.ROOT);
    Set<String> queryWords = significantWords(searchLower, true);

    List<SourceReference> candidates = new ArrayList<>();
    for (KnowledgeSource knowledge : knowledgeSources) {
      if (!knowledge.isUsable()) {
        continue;
      }
      String content = knowledge.content();
      String contentLower = content.toLowerCase(Locale.ROOT);
      Set<String> contentWords = significantWords(contentLower, false);

      double wordOverlap = 0.0;
      if (!queryWords.isEmpty()) {
        Set<String> shared = new HashSet<>(queryWords);
        shared.retainAll(contentWords);
        Set<String> union = new HashSet<>(queryWords);
        union.addAll(contentWords);
        wordOverlap = (double) shared.size() / union.size();
      }
      String window =
          contentLower.substring(0, Math.min(KNOWLEDGE_CHAR_LIMIT, contentLower.length()));
      double score = wordOverlap * 0.6 + SequenceSimilarity.ratio(searchLower, window) * 0.4;

      if (score >= config.getMinKnowledgeScore()) {
        String excerpt =
            content.length() > KNOWLEDGE_EXCERPT_LENGTH
                ? content.substring(0, KNOWLEDGE_EXCERPT_LENGTH) + "..."
                : content;
        String linked =
            "[" + knowledge.displayTitle() + "](" + nullToEmpty(knowledge.url()) + ")\n" + excerpt;
        candidates.add(SourceReference.knowledge(linked, knowledge.url(), score));
      }
    }

    List<SourceReference> top = topN(candidates, config.getMaxKnowledgeSources());
    meterRegistry.counter("grounding.sources.found", "type", "knowledge").increment(top.size());
    return top;
  }

  /**
   * Finds screenshots showing what a step describes. A UI element whose label matches the target
   * of an action ("Click the Create button" targets "create button") is strong evidence; overall
   * text similarity with the screenshot description is weaker evidence.
   *
   * @param step the generated step
   * @param screenshots analysed screenshots
   * @return up to the configured number of visual sources, strongest first
   */
  public List<SourceReference> findVisualSources(
      GeneratedStep step, List<ScreenshotEvidence> screenshots) {
    List<String> targets = actionTargets(step.actions());
    String searchLower = (step.title() + " " + step.content()).toLowerCase(Locale.ROOT);

    List<SourceReference> candidates = new ArrayList<>();
    for (ScreenshotEvidence screenshot : screenshots) {
      for (ScreenshotEvidence.UiElement element : screenshot.uiElements()) {
        String label = element.text().toLowerCase(Locale.ROOT).strip();
        if (label.isEmpty()) {
          continue;
        }
        for (String target : targets) {
          if (target.contains(label) || label.contains(target)) {
            candidates.add(
                SourceReference.visual(
                    "Screenshot showing " + element.type() + ": '" + element.text() + "'",
                    screenshot.filename(),
                    List.of(element.text()),
                    UI_ELEMENT_CONFIDENCE));
            break;
          }
        }
      }

      String content = screenshot.content();
      if (!content.isBlank()) {
        double similarity = SequenceSimilarity.ratio(searchLower, content.toLowerCase(Locale.ROOT));
        if (similarity >= config.getMinVisualScore()) {
          String preview = content.length() > 100 ? content.substring(0, 100) + "..." : content;
          candidates.add(
              SourceReference.visual(
                  "Screenshot content: " + preview, screenshot.filename(), List.of(), similarity));
        }
      }
    }

    List<SourceReference> top = topN(candidates, config.getMaxVisualSources());
    meterRegistry.counter("grounding.sources.found", "type", "visual").increment(top.size());
    return top;
  }

  /**
   * Overall confidence from transcript and knowledge evidence. The strongest three sources are
   * blended, then multiplied up for corroboration: more sources, both kinds of source, and at
   * least one strong match.
   *
   * @param data evidence for a step
   * @return confidence in [0, 1]; 0 when there is no evidence
   */
  public double calculateConfidence(StepSourceData data) {
    List<SourceReference> counted =
        data.getSources().stream()
            .filter(s -> s.type().countsTowardsConfidence())
            .sorted(Comparator.comparingDouble(SourceReference::confidence).reversed())
            .toList();
    if (counted.isEmpty()) {
      return 0.0;
    }

    double confidence;
    if (counted.size() == 1) {
      confidence = counted.get(0).confidence();
    } else if (counted.size() == 2) {
      confidence = counted.get(0).confidence() * 0.6 + counted.get(1).confidence() * 0.4;
    } else {
      confidence =
          counted.get(0).confidence() * 0.5
              + counted.get(1).confidence() * 0.3
              + counted.get(2).confidence() * 0.2;
    }

    if (counted.size() >= 4) {
      confidence *= 1.25;
    } else if (counted.size() == 3) {
      confidence *= 1.15;
    } else if (counted.size() == 2) {
      confidence *= 1.08;
    }

    boolean transcript = counted.stream().anyMatch(s -> s.type() == SourceType.TRANSCRIPT);
    boolean knowledge = counted.stream().anyMatch(s -> s.type() == SourceType.KNOWLEDGE);
    if (transcript && knowledge) {
      confidence *= 1.12;
    }
    if (counted.stream().anyMatch(s -> s.confidence() > 0.5)) {
      confidence *= 1.10;
    }

    return clamp(confidence);
  }

  /**
   * Blends evidence confidence with the structural quality score of the step.
   *
   * @param confidence evidence confidence
   * @param qualityScore structural quality from step validation
   * @return blended confidence in [0, 1]
   */
  public double enhanceConfidenceWithValidation(double confidence, double qualityScore) {
    double enhanced = confidence * 0.7 + qualityScore * 0.3;
    if (qualityScore >= 0.8) {
      enhanced *= 1.10;
    } else if (qualityScore >= 0.6) {
      enhanced *= 1.05;
    } else if (qualityScore < 0.3) {
      enhanced *= 0.95;
    }
    return clamp(enhanced);
  }

  /**
   * Decides whether a step is grounded and stores reader-facing warnings as its validation flags.
   *
   * @param data evidence for a step
   * @return verdict with warnings
   */
  public StepGroundingVerdict validateStep(StepSourceData data) {
    List<String> warnings = new ArrayList<>();
    double confidence = data.getOverallConfidence();
    String formatted = String.format("%.2f", confidence);

    if (confidence < 0.3) {
      warnings.add("Very low confidence (" + formatted + ") - may be hallucinated");
    } else if (confidence < 0.5) {
      warnings.add("Low confidence (" + formatted + ") - verify accuracy");
    } else if (confidence < 0.7) {
      warnings.add("Medium confidence (" + formatted + ") - generally reliable");
    }

    if (!data.hasTranscriptSupport()) {
      warnings.add("No transcript support found - verify against source material");
    }
    if (data.getSources().isEmpty()) {
      warnings.add("No source references found - content may be fabricated");
    } else if (data.getSources().size() == 1) {
      warnings.add("Only one source reference - limited validation");
    }

    boolean valid =
        confidence >= config.getMinStepConfidence()
            && data.hasTranscriptSupport()
            && !data.getSources().isEmpty();

    data.setValidationFlags(warnings);
    return new StepGroundingVerdict(valid, List.copyOf(warnings));
  }

  /**
   * Score penalty for citing a sentence that earlier steps already cited. Applies from the first
   * use and grows with every reuse up to the configured cap.
   *
   * @param priorCitations number of earlier citations
   * @return multiplicative penalty in [0, max]
   */
  public double reusePenalty(int priorCitations) {
    return Math.min(
        config.getMaxReusePenalty(), (priorCitations + 1) * config.getReusePenaltyStep());
  }

  private static String searchText(GeneratedStep step) {
    return step.title() + " " + step.content() + " " + String.join(" ", step.actions());
  }

  /** Punctuation-stripped words longer than two characters, in order of first appearance. */
  static Set<String> significantWords(String lowerText, boolean dropStopWords) {
    Set<String> words = new LinkedHashSet<>();
    for (String token : lowerText.split("\\s+")) {
      String word = stripPunctuation(token);
      if (word.length() > 2 && !(dropStopWords && STOP_WORDS.contains(word))) {
        words.add(word);
      }
    }
    return words;
  }

  private static String stripPunctuation(String token) {
    int start = 0;
    int end = token.length();
    while (start < end && STRIP_CHARS.indexOf(token.charAt(start)) >= 0) {
      start++;
    }
    while (end > start && STRIP_CHARS.indexOf(token.charAt(end - 1)) >= 0) {
      end--;
    }
    return token.substring(start, end);
  }

  private static List<String> adjacentPhrases(Set<String> orderedWords) {
    List<String> words = new ArrayList<>(orderedWords);
    List<String> phrases = new ArrayList<>();
    for (int i = 0; i < words.size() - 1; i++) {
      if (words.get(i).length() > 3 && words.get(i + 1).length() > 3) {
        phrases.add(words.get(i) + " " + words.get(i + 1));
      }
    }
    return phrases;
  }

  private static Set<String> stepVerbs(List<String> actions) {
    Set<String> verbs = new LinkedHashSet<>();
    for (String action : actions) {
      String lower = action.toLowerCase(Locale.ROOT);
      for (String verb : BOOST_VERBS) {
        if (containsWord(lower, verb)) {
          verbs.add(verb);
        }
      }
    }
    return verbs;
  }

  /** Targets of UI actions: the words after the first recognised verb, articles removed. */
  static List<String> actionTargets(List<String> actions) {
    List<String> targets = new ArrayList<>();
    for (String action : actions) {
      String lower = action.toLowerCase(Locale.ROOT);
      for (String verb : UI_ACTION_VERBS) {
        Matcher matcher = wordPattern(verb).matcher(lower);
        if (matcher.find()) {
          String target = ARTICLES.matcher(lower.substring(matcher.end())).replaceAll("").strip();
          target = stripPunctuation(target);
          if (!target.isEmpty()) {
            targets.add(target);
          }
          break;
        }
      }
    }
    return targets;
  }

  private static boolean containsWord(String lowerText, String word) {
    return wordPattern(word).matcher(lowerText).find();
  }

  private static Pattern wordPattern(String verb) {
    return VERB_PATTERNS.get(verb);
  }

  private static List<SourceReference> topN(List<SourceReference> candidates, int limit) {
    return candidates.stream()
        .sorted(Comparator.comparingDouble(SourceReference::confidence).reversed())
        .limit(limit)
        .toList();
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
