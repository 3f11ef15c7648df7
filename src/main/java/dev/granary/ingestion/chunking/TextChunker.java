package dev.granary.ingestion.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits text into overlapping whitespace word windows.
 *
 * <p>For N words, window size C and overlap O, texts with N &le; C yield one chunk equal to the
 * trimmed input; longer texts yield {@code ceil((N - O) / (C - O))} chunks, each starting {@code C
 * - O} words after the previous one, the last one ending at the final word.
 */
public final class TextChunker {

  public static final int DEFAULT_CHUNK_SIZE_WORDS = 512;
  public static final int DEFAULT_OVERLAP_WORDS = 50;

  private TextChunker() {
    // utility class
  }

  public static List<String> chunkText(String text) {
    return chunkText(text, DEFAULT_CHUNK_SIZE_WORDS, DEFAULT_OVERLAP_WORDS);
  }

  /**
   * @param text input text, may be empty
   * @param chunkSizeWords words per chunk, at least 1
   * @param overlapWords words shared by consecutive chunks, in {@code [0, chunkSizeWords)}
   * @return chunks in order; empty for blank input
   * @throws IllegalArgumentException when the size or overlap is out of range
   */
  public static List<String> chunkText(String text, int chunkSizeWords, int overlapWords) {
    if (chunkSizeWords < 1) {
      throw new IllegalArgumentException(
          "chunkSizeWords must be at least 1, got: " + chunkSizeWords);
    }
    if (overlapWords < 0 || overlapWords >= chunkSizeWords) {
      throw new IllegalArgumentException(
          "overlapWords must be in [0, " + chunkSizeWords + "), got: " + overlapWords);
    }
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String trimmed = text.strip();
    String[] words = trimmed.split("\\s+");
    if (words.length <= chunkSizeWords) {
      return List.of(trimmed);
    }

    int step = chunkSizeWords - overlapWords;
    List<String> chunks = new ArrayList<>();
    for (int start = 0; ; start += step) {
      int end = Math.min(start + chunkSizeWords, words.length);
      chunks.add(String.join(" ", Arrays.asList(words).subList(start, end)));
      if (end == words.length) {
        return chunks;
      }
    }
  }
}
