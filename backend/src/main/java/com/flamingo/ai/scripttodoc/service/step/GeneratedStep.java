package com.flamingo.ai.scripttodoc.service.step;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;

/**
 * A candidate training step produced by the step generator. Missing fields are defaulted when the
 * record is created so later stages never see nulls. Generators that answer with {@code overview}
 * or {@code content} instead of {@code summary} or {@code details} are accepted too.
 *
 * @param title short step title
 * @param summary one-paragraph overview
 * @param details full step instructions
 * @param actions individual user actions, in order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratedStep(
    String title,
    @JsonAlias("overview") String summary,
    @JsonAlias("content") String details,
    List<String> actions) {

  public GeneratedStep {
    title = title == null ? "" : title.strip();
    summary = summary == null ? "" : summary.strip();
    details = details == null ? "" : details.strip();
    List<String> cleaned = new ArrayList<>();
    if (actions != null) {
      for (String action : actions) {
        cleaned.add(action == null ? "" : action);
      }
    }
    actions = List.copyOf(cleaned);
  }

  /** Summary and details joined, the text grounding matches against the transcript. */
  public String content() {
    return (summary + " " + details).strip();
  }
}
