/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.prep;


/**
 * Turns a line of raw text into an integer sequence. Tokenization algorithms
 * live outside this library; implementations are plugged in here. Instances
 * used by the {@linkplain ParallelPreprocessor} are invoked concurrently and
 * must be thread-safe (stateless, ideally).
 */
@FunctionalInterface
public interface Tokenizer {
  
  /**
   * For text that is already tokenized: parses whitespace-separated
   * base-10 integers. Blank text yields an empty sequence. Also parses the
   * fields of {@linkplain io.crums.seqbatch.store.TsvRecordStore flat-file} lines.
   * 
   * @throws NumberFormatException on a malformed integer
   */
  Tokenizer INTEGERS = line -> {
    String trimmed = line.strip();
    if (trimmed.isEmpty())
      return new int[0];
    String[] tokens = trimmed.split("\\s+");
    int[] seq = new int[tokens.length];
    for (int index = 0; index < tokens.length; ++index)
      seq[index] = Integer.parseInt(tokens[index]);
    return seq;
  };
  
  
  /**
   * Returns the integer sequence for the given line.
   * 
   * @param line  stripped, non-empty text
   */
  int[] tokenize(String line);

}
