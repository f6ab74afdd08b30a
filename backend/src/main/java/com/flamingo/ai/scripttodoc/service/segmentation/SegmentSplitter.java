package com.flamingo.ai.scripttodoc.service.segmentation;

import com.flamingo.ai.scripttodoc.service.transcript.ParsedSentence;
import java.util.ArrayList;
import java.util.List;

/** Raises a segmentation to a minimum segment count by splitting its largest segments. */
public final class SegmentSplitter {

  private SegmentSplitter() {}

  /**
   * Splits the largest segment into even parts until at least {@code minTotal} segments exist or
   * every segment is a single sentence. Parts keep at least {@code minSegmentSentences} sentences
   * where the segment is large enough, and are marked as fallback splits.
   *
   * @param segments segments in transcript order
   * @param minTotal segment count to reach
   * @param minSegmentSentences preferred minimum size of each part
   * @return a new list, re-indexed from 0
   */
  public static List<TopicSegment> ensureMinimum(
      List<TopicSegment> segments, int minTotal, int minSegmentSentences) {
    List<TopicSegment> result = new ArrayList<>(segments);

    while (!result.isEmpty() && result.size() < minTotal) {
      int largestIndex = 0;
      for (int i = 1; i < result.size(); i++) {
        if (result.get(i).size() > result.get(largestIndex).size()) {
          largestIndex = i;
        }
      }
      TopicSegment largest = result.get(largestIndex);
      if (largest.size() < 2) {
        break;
      }

      int wanted = minTotal - result.size() + 1;
      int parts = Math.min(wanted, largest.size() / Math.max(1, minSegmentSentences));
      if (parts < 2) {
        // Too small to respect the preferred size; split anyway
        parts = Math.min(wanted, largest.size());
      }

      result.remove(largestIndex);
      result.addAll(largestIndex, splitEvenly(largest, parts));
    }

    return reindex(result);
  }

  static List<TopicSegment> reindex(List<TopicSegment> segments) {
    List<TopicSegment> reindexed = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      TopicSegment segment = segments.get(i);
      reindexed.add(segment.getSegmentIndex() == i ? segment : segment.withIndex(i));
    }
    return reindexed;
  }

  private static List<TopicSegment> splitEvenly(TopicSegment segment, int parts) {
    List<ParsedSentence> sentences = segment.getSentences();
    int base = sentences.size() / parts;
    int remainder = sentences.size() % parts;

    List<TopicSegment> pieces = new ArrayList<>(parts);
    int from = 0;
    for (int part = 0; part < parts; part++) {
      int to = from + base + (part < remainder ? 1 : 0);
      pieces.add(
          new TopicSegment(
              segment.getSegmentIndex(), sentences.subList(from, to), 0.0, true));
      from = to;
    }
    return pieces;
  }
}
