package com.flamingo.ai.scripttodoc.service.validation;

/**
 * How the leading verb of one action was judged.
 *
 * @param verb the leading verb, lowercased, empty for blank actions
 * @param weak whether the verb describes learning or intent rather than something to do
 * @param suggestion replacement wording for weak verbs, otherwise null
 * @param warning advisory note for unknown verbs or blank actions, otherwise null
 */
public record ActionVerdict(String verb, boolean weak, String suggestion, String warning) {

  public boolean valid() {
    return !weak;
  }
}
