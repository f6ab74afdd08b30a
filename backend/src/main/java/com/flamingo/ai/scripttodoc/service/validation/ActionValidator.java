package com.flamingo.ai.scripttodoc.service.validation;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.service.step.GeneratedStep;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks that a step tells the reader what to do: actions lead with concrete verbs, the step has
 * enough actions and content, and the title reads as an action.
 *
 * <p>Results are advisory. The pipeline records issues as validation flags on the step's evidence
 * and leaves accept/reject decisions to {@link StepValidator} and grounding.
 */
@Service
@Slf4j
public class ActionValidator {

  /** Verbs describing learning, looking or intent rather than an action. */
  private static final Set<String> WEAK_VERBS =
      Set.of(
          "learn", "understand", "know", "remember", "recall", "recognize", "comprehend", "grasp",
          "appreciate", "realize", "familiarize", "review", "read", "study", "examine", "consider",
          "explore", "note", "observe", "watch", "see", "view", "ensure", "try", "attempt",
          "handle", "manage");

  /** Multi-word weak verbs, matched as a prefix of the action. */
  private static final List<String> WEAK_PHRASES =
      List.of(
          "take care of", "keep in mind", "look at", "check out", "be aware", "make sure",
          "work on", "deal with");

  private static final Set<String> STRONG_VERBS =
      Set.of(
          // configuration
          "configure", "set", "enable", "disable", "update", "modify", "adjust", "customize",
          "change", "edit", "setup",
          // creation
          "create", "add", "define", "initialize", "generate", "build", "construct", "establish",
          "develop", "make", "design",
          // execution
          "run", "execute", "deploy", "install", "implement", "apply", "launch", "start",
          "invoke", "trigger", "activate",
          // navigation
          "navigate", "open", "access", "go", "select", "click", "choose", "pick", "locate",
          "find",
          // verification
          "verify", "test", "validate", "confirm", "check", "monitor", "inspect", "assess",
          "evaluate",
          // removal
          "remove", "delete", "clear", "reset", "uninstall", "deactivate", "stop", "terminate",
          "kill",
          // data
          "enter", "input", "type", "specify", "provide", "fill", "insert", "paste", "upload",
          "download", "copy",
          // organization
          "organize", "arrange", "sort", "group", "categorize", "structure", "order",
          "prioritize");

  private static final Map<String, String> VERB_SUGGESTIONS =
      Map.ofEntries(
          Map.entry("learn", "Complete the tutorial, then configure"),
          Map.entry("understand", "Review the documentation, then implement"),
          Map.entry("review", "Analyze the configuration and update"),
          Map.entry("read", "Open the file and identify"),
          Map.entry("ensure", "Verify"),
          Map.entry("make sure", "Confirm"),
          Map.entry("try", "Execute"),
          Map.entry("attempt", "Run"),
          Map.entry("check out", "Examine"),
          Map.entry("look at", "Open"),
          Map.entry("be aware", "Note"),
          Map.entry("keep in mind", "Remember"),
          Map.entry("familiarize", "Study the documentation, then configure"));

  private static final String STRIP_CHARS = ".,!?;:()[]{}\"'";

  private final PipelineConfig.ActionValidation config;
  private final MeterRegistry meterRegistry;

  public ActionValidator(PipelineConfig pipelineConfig, MeterRegistry meterRegistry) {
    this.config = pipelineConfig.getActionValidation();
    this.config.validate();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Judges the leading verb of an action.
   *
   * @param action action text, e.g. "Configure the settings"
   * @return verdict for the verb
   */
  public ActionVerdict checkVerb(String action) {
    String lower = action == null ? "" : action.strip().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return new ActionVerdict("", true, null, "Empty action text");
    }

    for (String phrase : WEAK_PHRASES) {
      if (lower.equals(phrase) || lower.startsWith(phrase + " ")) {
        return weak(phrase);
      }
    }

    String verb = stripPunctuation(lower.split("\\s+")[0]);
    if (WEAK_VERBS.contains(verb)) {
      return weak(verb);
    }
    if (STRONG_VERBS.contains(verb)) {
      return new ActionVerdict(verb, false, null, null);
    }
    return new ActionVerdict(
        verb, false, null, "Consider using a more specific verb than '" + verb + "'");
  }

  /**
   * Checks a step's actions, content and title.
   *
   * @param step generated step
   * @return advisory issues and warnings
   */
  public ActionValidationResult validate(GeneratedStep step) {
    List<String> issues = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    List<String> weakVerbs = new ArrayList<>();

    List<String> actions = step.actions();
    int count = actions.size();
    if (count < config.getMinActions()) {
      issues.add(
          "Insufficient actions: " + count + " (minimum " + config.getMinActions() + ")");
    } else if (count > config.getMaxActions()) {
      issues.add("Too many actions: " + count + " (maximum " + config.getMaxActions() + ")");
    }

    for (int i = 0; i < count; i++) {
      ActionVerdict verdict = checkVerb(actions.get(i));
      if (verdict.weak()) {
        weakVerbs.add(verdict.verb());
        String reason =
            verdict.suggestion() != null ? verdict.suggestion() : verdict.warning();
        issues.add("Action " + (i + 1) + " has weak verb '" + verdict.verb() + "': " + reason);
      } else if (verdict.warning() != null) {
        warnings.add("Action " + (i + 1) + ": " + verdict.warning());
      }
    }

    String content = !step.details().isBlank() ? step.details() : step.summary();
    int words = content.isBlank() ? 0 : content.strip().split("\\s+").length;
    if (words < config.getMinContentWords()) {
      issues.add(
          "Content too thin: " + words + " words (minimum " + config.getMinContentWords() + ")");
    }

    String title = step.title().strip();
    if (title.isEmpty()) {
      issues.add("Missing title");
    } else {
      String first = stripPunctuation(title.split("\\s+")[0].toLowerCase(Locale.ROOT));
      if (!first.endsWith("ing") && !STRONG_VERBS.contains(first)) {
        warnings.add(
            "Title '" + title + "' should start with an action verb or gerund, e.g. 'Configuring'");
      }
    }

    String summary = step.summary().strip();
    if (summary.isEmpty()) {
      warnings.add("Missing overview/summary");
    } else if (summary.equalsIgnoreCase(title)) {
      warnings.add("Overview should not repeat the title");
    }

    if (!weakVerbs.isEmpty()) {
      meterRegistry.counter("validation.actions.weak_verbs").increment(weakVerbs.size());
    }
    return new ActionValidationResult(issues.isEmpty(), count, issues, warnings, weakVerbs);
  }

  /**
   * Totals action results over a document.
   *
   * @param results one result per step
   * @return summary, all zero for no results
   */
  public ActionValidationSummary summarize(List<ActionValidationResult> results) {
    if (results == null || results.isEmpty()) {
      return ActionValidationSummary.empty();
    }
    int passed = 0;
    int issues = 0;
    int warnings = 0;
    Set<String> weakVerbs = new TreeSet<>();
    for (ActionValidationResult result : results) {
      if (result.passed()) {
        passed++;
      }
      issues += result.issues().size();
      warnings += result.warnings().size();
      weakVerbs.addAll(result.weakVerbs());
    }
    ActionValidationSummary summary =
        new ActionValidationSummary(
            results.size(),
            passed,
            results.size() - passed,
            new ArrayList<>(weakVerbs),
            issues,
            warnings);
    log.info(
        "Action validation: {}/{} steps passed, {} issues, {} warnings",
        passed,
        results.size(),
        issues,
        warnings);
    return summary;
  }

  private static ActionVerdict weak(String verb) {
    String suggestion =
        VERB_SUGGESTIONS.getOrDefault(
            verb, "Use a specific action verb instead of '" + verb + "'");
    return new ActionVerdict(verb, true, suggestion, null);
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
}
