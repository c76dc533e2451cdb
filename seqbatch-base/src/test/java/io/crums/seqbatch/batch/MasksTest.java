/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.batch;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class MasksTest {
  
  
  @Test
  public void testSubsequent() {
    boolean[][] mask = Masks.subsequentMask(3);
    assertArrayEquals(new boolean[] { true, false, false }, mask[0]);
    assertArrayEquals(new boolean[] { true, true, false }, mask[1]);
    assertArrayEquals(new boolean[] { true, true, true }, mask[2]);
    assertEquals(0, Masks.subsequentMask(0).length);
  }
  
  
  @Test
  public void testPadding() {
    int[][] seqs = { { 4, 5, 0 }, { 6, 0, 0 } };
    boolean[][] mask = Masks.paddingMask(seqs, 0);
    assertArrayEquals(new boolean[] { true, true, false }, mask[0]);
    assertArrayEquals(new boolean[] { true, false, false }, mask[1]);
  }
  
  
  @Test
  public void testAutoRegressive() {
    int[][] seqs = { { 4, 5, 0 } };
    boolean[][][] mask = Masks.autoRegressiveMask(seqs, 0);
    assertArrayEquals(new boolean[] { true, false, false }, mask[0][0]);
    assertArrayEquals(new boolean[] { true, true, false }, mask[0][1]);
    // the pad column stays masked, even on the diagonal
    assertArrayEquals(new boolean[] { true, true, false }, mask[0][2]);
  }
  
  
  @Test
  public void testLength() {
    boolean[][] mask = Masks.lengthMask(new int[] { 2, 4 }, -1);
    assertEquals(4, mask[0].length);
    assertArrayEquals(new boolean[] { true, true, false, false }, mask[0]);
    assertArrayEquals(new boolean[] { true, true, true, true }, mask[1]);
    
    mask = Masks.lengthMask(new int[] { 5 }, 3);
    assertArrayEquals(new boolean[] { true, true, true }, mask[0]);
  }

}
