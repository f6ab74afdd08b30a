package com.flamingo.ai.scripttodoc.service.grounding;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp similarity: twice the number of characters in matching blocks over the total
 * length. Matching blocks are found by taking the longest common substring and recursing on the
 * text to either side of it.
 */
final class SequenceSimilarity {

  private SequenceSimilarity() {}

  static double ratio(String first, String second) {
    int total = first.length() + second.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * matchingCharacters(first, second) / total;
  }

  static int matchingCharacters(String a, String b) {
    int matches = 0;
    Deque<int[]> ranges = new ArrayDeque<>();
    ranges.push(new int[] {0, a.length(), 0, b.length()});
    while (!ranges.isEmpty()) {
      int[] range = ranges.pop();
      int[] match = longestMatch(a, range[0], range[1], b, range[2], range[3]);
      int size = match[2];
      if (size == 0) {
        continue;
      }
      matches += size;
      if (range[0] < match[0] && range[2] < match[1]) {
        ranges.push(new int[] {range[0], match[0], range[2], match[1]});
      }
      if (match[0] + size < range[1] && match[1] + size < range[3]) {
        ranges.push(new int[] {match[0] + size, range[1], match[1] + size, range[3]});
      }
    }
    return matches;
  }

  /** Longest common substring of a[aLo, aHi) and b[bLo, bHi); earliest in a wins ties. */
  private static int[] longestMatch(String a, int aLo, int aHi, String b, int bLo, int bHi) {
    int bestA = aLo;
    int bestB = bLo;
    int bestSize = 0;
    int width = bHi - bLo;
    int[] previous = new int[width + 1];
    int[] current = new int[width + 1];
    for (int i = aLo; i < aHi; i++) {
      for (int j = bLo; j < bHi; j++) {
        int col = j - bLo + 1;
        if (a.charAt(i) == b.charAt(j)) {
          current[col] = previous[col - 1] + 1;
          if (current[col] > bestSize) {
            bestSize = current[col];
            bestA = i - bestSize + 1;
            bestB = j - bestSize + 1;
          }
        } else {
          current[col] = 0;
        }
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return new int[] {bestA, bestB, bestSize};
  }
}
