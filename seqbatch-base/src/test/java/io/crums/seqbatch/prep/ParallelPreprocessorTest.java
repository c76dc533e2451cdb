/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.prep;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.seqbatch.CorpusMismatchException;
import io.crums.seqbatch.SeqPair;

/**
 * 
 */
public class ParallelPreprocessorTest {
  
  @TempDir
  File dir;
  
  
  private File write(String name, String text) throws IOException {
    File file = new File(dir, name);
    Files.writeString(file.toPath(), text, StandardCharsets.UTF_8);
    return file;
  }
  
  
  private static ParallelPreprocessor newInstance(LengthPolicy policy, int workers) {
    return new ParallelPreprocessor(Tokenizer.INTEGERS, Tokenizer.INTEGERS, policy, workers);
  }
  
  
  @Test
  public void testMismatch() throws IOException {
    File src = write("train.src", "1 2\n3\n4\n");
    File tgt = write("train.tgt", "5\n6\n");
    var prep = newInstance(LengthPolicy.DEFAULT, 2);
    assertThrows(CorpusMismatchException.class, () -> prep.processParallel(src, tgt));
  }
  
  
  @Test
  public void testFilterAndOrder() throws IOException {
    File src = write("train.src",
        """
        1 2
        3 4 5 6
        
        7
        8
        """);
    File tgt = write("train.tgt",
        """
        9
        10
        11
        12 13 14 15
        16
        """);
    var prep = newInstance(new LengthPolicy(3, 3, false), 3);
    List<SeqPair> pairs = prep.processParallel(src, tgt);
    assertEquals(
        List.of(
            new SeqPair(new int[] { 1, 2 }, new int[] { 9 }),
            new SeqPair(new int[] { 8 }, new int[] { 16 })),
        pairs);
  }
  
  
  @Test
  public void testTruncate() throws IOException {
    File src = write("train.src", "1 2 3 4\n");
    File tgt = write("train.tgt", "5 6 7 8 9\n");
    var prep = newInstance(new LengthPolicy(2, 3, true), 1);
    assertEquals(
        List.of(new SeqPair(new int[] { 1, 2 }, new int[] { 5, 6, 7 })),
        prep.processParallel(src, tgt));
  }
  
  
  @Test
  public void testOrderAcrossChunks() throws IOException {
    final int lines = ParallelPreprocessor.CHUNK_SIZE * 3 + 17;
    var s = new StringBuilder();
    var t = new StringBuilder();
    for (int index = 0; index < lines; ++index) {
      s.append(index).append('\n');
      t.append(index + 1).append(' ').append(index + 2).append('\n');
    }
    File src = write("big.src", s.toString());
    File tgt = write("big.tgt", t.toString());
    var pairs = newInstance(LengthPolicy.DEFAULT, 4).processParallel(src, tgt);
    assertEquals(lines, pairs.size());
    for (int index = 0; index < lines; ++index) {
      assertEquals(index, pairs.get(index).x()[0]);
      assertEquals(index + 2, pairs.get(index).y()[1]);
    }
  }
  
  
  @Test
  public void testMono() throws IOException {
    File file = write("mono.txt", "1 2\n\n3 4 5\n6\n");
    var seqs = newInstance(new LengthPolicy(2, 2, false), 2).processMono(file);
    assertEquals(2, seqs.size());
    assertArrayEquals(new int[] { 1, 2 }, seqs.get(0));
    assertArrayEquals(new int[] { 6 }, seqs.get(1));
  }
  
  
  @Test
  public void testTokenizerFailure() throws IOException {
    File src = write("train.src", "1 2\nnope\n");
    File tgt = write("train.tgt", "3\n4\n");
    var prep = newInstance(LengthPolicy.DEFAULT, 2);
    assertThrows(NumberFormatException.class, () -> prep.processParallel(src, tgt));
  }
  
  
  @Test
  public void testBadWorkers() {
    assertThrows(IllegalArgumentException.class, () -> newInstance(LengthPolicy.DEFAULT, 0));
  }

}
