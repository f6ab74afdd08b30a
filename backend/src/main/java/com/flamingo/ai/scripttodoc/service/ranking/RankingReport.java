package com.flamingo.ai.scripttodoc.service.ranking;

import java.util.List;

/**
 * Per-segment scores and their distribution.
 *
 * @param totalSegments number of scored segments
 * @param scores scores rounded to three decimals, in segment order
 * @param statistics distribution of importance scores, null when there were no segments
 */
public record RankingReport(int totalSegments, List<TopicScore> scores, Statistics statistics) {

  /**
   * Distribution of importance scores.
   *
   * @param average mean importance
   * @param max highest importance
   * @param min lowest importance
   * @param standardDeviation population standard deviation
   * @param highCount segments at or above 0.7
   * @param mediumCount segments from 0.3 up to 0.7
   * @param lowCount segments below 0.3
   */
  public record Statistics(
      double average,
      double max,
      double min,
      double standardDeviation,
      int highCount,
      int mediumCount,
      int lowCount) {}
}
