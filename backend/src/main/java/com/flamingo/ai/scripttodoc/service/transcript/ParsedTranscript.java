package com.flamingo.ai.scripttodoc.service.transcript;

import java.util.List;

/**
 * Parser output: analysed sentences plus transcript-wide metadata.
 *
 * @param sentences sentences in transcript order
 * @param metadata statistics over the sentences
 */
public record ParsedTranscript(List<ParsedSentence> sentences, TranscriptMetadata metadata) {

  public ParsedTranscript {
    sentences = sentences == null ? List.of() : List.copyOf(sentences);
    metadata = metadata == null ? TranscriptMetadata.empty() : metadata;
  }

  public boolean isEmpty() {
    return sentences.isEmpty();
  }
}
