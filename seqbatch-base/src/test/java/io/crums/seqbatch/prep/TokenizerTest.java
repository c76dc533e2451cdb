/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.prep;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class TokenizerTest {
  
  
  @Test
  public void testIntegers() {
    assertArrayEquals(new int[] { 3, 17, -2 }, Tokenizer.INTEGERS.tokenize(" 3\t17   -2 "));
    assertArrayEquals(new int[0], Tokenizer.INTEGERS.tokenize("  \t "));
    assertThrows(NumberFormatException.class, () -> Tokenizer.INTEGERS.tokenize("3 4.5"));
  }

}
