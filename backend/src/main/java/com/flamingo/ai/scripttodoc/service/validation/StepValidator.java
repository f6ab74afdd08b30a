package com.flamingo.ai.scripttodoc.service.validation;

import com.flamingo.ai.scripttodoc.config.PipelineConfig;
import com.flamingo.ai.scripttodoc.service.step.GeneratedStep;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Structural quality gate for generated steps, independent of grounding. Every problem is
 * reported as a typed issue; a step is valid when none of its issues is an error.
 */
@Service
@Slf4j
public class StepValidator {

  private static final List<Pattern> GENERIC_TITLES =
      List.of(
          Pattern.compile("^step \\d+$"),
          Pattern.compile("^untitled"),
          Pattern.compile("^new step"),
          Pattern.compile("^todo"),
          Pattern.compile("^instructions?$"));

  private static final double HIGH_QUALITY = 0.8;
  private static final double MEDIUM_QUALITY = 0.5;

  private final PipelineConfig.Validation config;
  private final MeterRegistry meterRegistry;

  public StepValidator(PipelineConfig pipelineConfig, MeterRegistry meterRegistry) {
    this.config = pipelineConfig.getValidation();
    this.config.validate();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Validates one step.
   *
   * @param step generated step
   * @param stepIndex position of the step in the document
   * @param confidence grounding confidence of the step
   * @return validation outcome with quality score and issues
   */
  public ValidationResult validate(GeneratedStep step, int stepIndex, double confidence) {
    Issues issues = new Issues();

    validateActions(step.actions(), issues);
    validateTitle(step.title(), issues);
    validateDetails(step.details(), issues);
    validateConfidence(confidence, issues);
    boolean duplicates = checkDuplicates(step.actions(), issues);

    double quality =
        qualityScore(
            step.actions().size(), step.title().length(), step.details().length(), confidence);
    boolean valid = issues.errors.isEmpty();

    List<String> fixes = List.of();
    if (config.isAutoFixEnabled() && !valid) {
      fixes = suggestFixes(issues, step.actions().size(), duplicates);
    }

    ValidationResult result =
        new ValidationResult(
            stepIndex,
            valid,
            quality,
            issues.errors,
            issues.warnings,
            issues.info,
            step.actions().size(),
            step.title().length(),
            step.details().length(),
            confidence,
            duplicates,
            !fixes.isEmpty(),
            fixes);

    if (!valid) {
      meterRegistry.counter("validation.steps.invalid").increment();
    }
    log.debug(
        "Step {} validation: valid={}, quality={}, errors={}, warnings={}",
        stepIndex,
        valid,
        String.format("%.2f", quality),
        issues.errors.size(),
        issues.warnings.size());
    return result;
  }

  /**
   * Validates steps in order, using each step's position as its index.
   *
   * @param steps generated steps
   * @param confidences grounding confidence per step, same order and size as {@code steps}
   * @return one result per step
   */
  public List<ValidationResult> validateSteps(
      List<GeneratedStep> steps, List<Double> confidences) {
    if (steps.size() != confidences.size()) {
      throw new IllegalArgumentException(
          "Expected one confidence per step, got "
              + confidences.size()
              + " for "
              + steps.size()
              + " steps");
    }
    List<ValidationResult> results = new ArrayList<>(steps.size());
    for (int i = 0; i < steps.size(); i++) {
      results.add(validate(steps.get(i), i, confidences.get(i)));
    }
    long validCount = results.stream().filter(ValidationResult::valid).count();
    log.info(
        "Validated {} steps: {} valid, {} invalid",
        results.size(),
        validCount,
        results.size() - validCount);
    return results;
  }

  /**
   * Summarises validation results for diagnostics.
   *
   * @param results results from {@link #validateSteps}
   * @return aggregate report, all zero for no results
   */
  public ValidationReport getValidationReport(List<ValidationResult> results) {
    if (results == null || results.isEmpty()) {
      return ValidationReport.empty();
    }

    int valid = 0;
    double qualitySum = 0.0;
    double minQuality = Double.MAX_VALUE;
    double maxQuality = -Double.MAX_VALUE;
    double actionSum = 0.0;
    double confidenceSum = 0.0;
    int high = 0;
    int medium = 0;
    int low = 0;
    Map<String, Integer> byType = new TreeMap<>();
    Map<IssueSeverity, Integer> bySeverity = new EnumMap<>(IssueSeverity.class);
    for (IssueSeverity severity : IssueSeverity.values()) {
      bySeverity.put(severity, 0);
    }

    for (ValidationResult result : results) {
      if (result.valid()) {
        valid++;
      }
      double quality = result.qualityScore();
      qualitySum += quality;
      minQuality = Math.min(minQuality, quality);
      maxQuality = Math.max(maxQuality, quality);
      actionSum += result.actionCount();
      confidenceSum += result.confidenceScore();
      if (quality >= HIGH_QUALITY) {
        high++;
      } else if (quality >= MEDIUM_QUALITY) {
        medium++;
      } else {
        low++;
      }
      countIssues(result.errors(), byType, bySeverity);
      countIssues(result.warnings(), byType, bySeverity);
      countIssues(result.info(), byType, bySeverity);
    }

    int total = results.size();
    return new ValidationReport(
        total,
        valid,
        total - valid,
        (double) valid / total,
        new ValidationReport.Statistics(
            qualitySum / total,
            minQuality,
            maxQuality,
            actionSum / total,
            confidenceSum / total,
            high,
            medium,
            low),
        byType,
        bySeverity);
  }

  private void validateActions(List<String> actions, Issues issues) {
    int count = actions.size();
    if (count < config.getMinActions()) {
      issues.errors.add(
          ValidationIssue.error(
              IssueType.INSUFFICIENT_ACTIONS,
              "actions",
              String.format("Step has %d actions, minimum is %d", count, config.getMinActions()),
              String.format(
                  "Add at least %d more action(s)", config.getMinActions() - count)));
    }
    if (count > config.getMaxActions()) {
      issues.warnings.add(
          ValidationIssue.warning(
              IssueType.TOO_MANY_ACTIONS,
              "actions",
              String.format(
                  "Step has %d actions, which may be too many (max recommended: %d)",
                  count, config.getMaxActions()),
              "Consider splitting this step into multiple steps"));
    }

    List<Integer> empty = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      if (actions.get(i).isBlank()) {
        empty.add(i);
      }
    }
    if (!empty.isEmpty()) {
      issues.errors.add(
          ValidationIssue.error(
              IssueType.EMPTY_ACTIONS,
              "actions",
              String.format(
                  "Step has %d empty action(s) at indices: %s", empty.size(), empty),
              "Remove empty actions or add descriptive text"));
    }
  }

  private void validateTitle(String title, Issues issues) {
    if (title.isBlank()) {
      issues.errors.add(
          ValidationIssue.error(
              IssueType.MISSING_TITLE,
              "title",
              "Step has no title",
              "Add a descriptive title for this step"));
      return;
    }

    int length = title.length();
    if (length < config.getMinTitleLength()) {
      issues.warnings.add(
          ValidationIssue.warning(
              IssueType.SHORT_TITLE,
              "title",
              String.format(
                  "Title is too short (%d chars, minimum %d)", length, config.getMinTitleLength()),
              "Use a more descriptive title"));
    }
    if (length > config.getMaxTitleLength()) {
      issues.warnings.add(
          ValidationIssue.warning(
              IssueType.LONG_TITLE,
              "title",
              String.format(
                  "Title is too long (%d chars, maximum %d)", length, config.getMaxTitleLength()),
              "Shorten the title or move details to the details field"));
    }
    if (config.isRequireDescriptiveTitle() && isGenericTitle(title)) {
      issues.info.add(
          ValidationIssue.info(
              IssueType.GENERIC_TITLE,
              "title",
              "Title may not be descriptive enough",
              "Use specific action words (e.g., 'Configure', 'Create', 'Navigate')"));
    }
  }

  private void validateDetails(String details, Issues issues) {
    if (config.isRequireDetails() && details.isBlank()) {
      issues.errors.add(
          ValidationIssue.error(
              IssueType.MISSING_DETAILS,
              "details",
              "Step has no details",
              "Add context or additional information about this step"));
      return;
    }
    if (details.length() < config.getMinDetailsLength()) {
      issues.warnings.add(
          ValidationIssue.warning(
              IssueType.INSUFFICIENT_DETAILS,
              "details",
              String.format(
                  "Details are too short (%d chars, minimum %d)",
                  details.length(), config.getMinDetailsLength()),
              "Add more context or explanation about this step"));
    }
  }

  private void validateConfidence(double confidence, Issues issues) {
    if (confidence < config.getMinConfidence()) {
      issues.errors.add(
          ValidationIssue.error(
              IssueType.VERY_LOW_CONFIDENCE,
              "confidence",
              String.format(
                  "Step has very low confidence (%.2f < %.2f)",
                  confidence, config.getMinConfidence()),
              "Review step quality - may need more source information"));
    } else if (confidence < config.getLowConfidence()) {
      issues.warnings.add(
          ValidationIssue.warning(
              IssueType.LOW_CONFIDENCE,
              "confidence",
              String.format(
                  "Step has low confidence (%.2f < %.2f)", confidence, config.getLowConfidence()),
              "Consider adding more context from source material"));
    }
  }

  private boolean checkDuplicates(List<String> actions, Issues issues) {
    if (!config.isWarnOnDuplicates()) {
      return false;
    }
    Set<String> seen = new HashSet<>();
    List<Integer> duplicates = new ArrayList<>();
    for (int i = 0; i < actions.size(); i++) {
      if (!seen.add(actions.get(i).strip().toLowerCase(Locale.ROOT))) {
        duplicates.add(i);
      }
    }
    if (duplicates.isEmpty()) {
      return false;
    }
    issues.warnings.add(
        ValidationIssue.warning(
            IssueType.DUPLICATE_ACTIONS,
            "actions",
            String.format(
                "Step has %d duplicate action(s) at indices: %s", duplicates.size(), duplicates),
            "Remove or rephrase duplicate actions"));
    return true;
  }

  static boolean isGenericTitle(String title) {
    String normalized = title.strip().toLowerCase(Locale.ROOT);
    for (Pattern pattern : GENERIC_TITLES) {
      if (pattern.matcher(normalized).find()) {
        return true;
      }
    }
    return false;
  }

  double qualityScore(int actionCount, int titleLength, int detailsLength, double confidence) {
    double actionScore =
        actionCount >= config.getMinActions()
            ? Math.min(1.0, actionCount / (config.getMinActions() * 2.0))
            : (double) actionCount / config.getMinActions();

    double titleScore =
        titleLength >= config.getMinTitleLength()
            ? Math.min(1.0, (double) titleLength / config.getMaxTitleLength())
            : (double) titleLength / config.getMinTitleLength();

    double detailsScore;
    if (detailsLength >= config.getMinDetailsLength()) {
      detailsScore = Math.min(1.0, detailsLength / (config.getMinDetailsLength() * 3.0));
    } else if (config.isRequireDetails()) {
      detailsScore = (double) detailsLength / config.getMinDetailsLength();
    } else {
      detailsScore = 1.0;
    }

    double quality =
        actionScore * config.getActionWeight()
            + titleScore * config.getTitleWeight()
            + detailsScore * config.getDetailsWeight()
            + confidence * config.getConfidenceWeight();
    return Math.max(0.0, Math.min(1.0, quality));
  }

  private List<String> suggestFixes(Issues issues, int actionCount, boolean duplicates) {
    List<String> fixes = new ArrayList<>();
    if (issues.hasError(IssueType.INSUFFICIENT_ACTIONS)) {
      fixes.add(
          String.format(
              "Add %d more action(s) to meet minimum requirement",
              config.getMinActions() - actionCount));
    }
    if (issues.hasError(IssueType.MISSING_TITLE)) {
      fixes.add("Generate title from step actions or context");
    }
    if (issues.hasError(IssueType.MISSING_DETAILS)) {
      fixes.add("Generate details from source transcript or knowledge");
    }
    if (duplicates) {
      fixes.add("Remove duplicate actions automatically");
    }
    return fixes;
  }

  private static void countIssues(
      List<ValidationIssue> issues,
      Map<String, Integer> byType,
      Map<IssueSeverity, Integer> bySeverity) {
    for (ValidationIssue issue : issues) {
      byType.merge(issue.type().code(), 1, Integer::sum);
      bySeverity.merge(issue.severity(), 1, Integer::sum);
    }
  }

  private static final class Issues {
    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();
    private final List<ValidationIssue> info = new ArrayList<>();

    private boolean hasError(IssueType type) {
      return errors.stream().anyMatch(issue -> issue.type() == type);
    }
  }
}
