/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class SeqRecordTest {
  
  
  @Test
  public void testParallel() {
    int[] x = { 5, 6 };
    var record = new SeqRecord(3, x, new int[] { 7 });
    x[0] = 99;
    assertEquals(5, record.x(0));
    assertEquals(2, record.xLen());
    assertEquals(1, record.yLen());
    assertEquals(2, record.maxLen());
    assertTrue(record.hasY());
    assertFalse(record.hasEmptySide());
    
    record.x()[1] = 99;
    assertEquals(6, record.x(1));
  }
  
  
  @Test
  public void testMono() {
    var record = new SeqRecord(0, new int[] { 1, 2, 3 });
    assertFalse(record.hasY());
    assertEquals(SeqBatchConstants.NO_Y_LEN, record.yLen());
    assertEquals(3, record.maxLen());
    assertNull(record.y());
    assertFalse(record.hasEmptySide());
  }
  
  
  @Test
  public void testEmptySides() {
    assertTrue(new SeqRecord(0, new int[0]).hasEmptySide());
    assertTrue(new SeqRecord(0, new int[] { 1 }, new int[0]).hasEmptySide());
    assertTrue(new SeqRecord(0, new int[0], new int[] { 1 }).hasEmptySide());
  }
  
  
  @Test
  public void testTruncate() {
    var record = new SeqRecord(1, new int[] { 1, 2, 3, 4 }, new int[] { 5, 6 });
    assertTrue(record.exceeds(3, 3));
    assertFalse(record.exceeds(4, 2));
    
    var cut = record.truncate(3, 1);
    assertArrayEquals(new int[] { 1, 2, 3 }, cut.x());
    assertArrayEquals(new int[] { 5 }, cut.y());
    assertEquals(1, cut.id());
    assertSame(record, record.truncate(10, 10));
  }
  
  
  @Test
  public void testEquals() {
    var a = new SeqRecord(1, new int[] { 1, 2 }, new int[] { 3 });
    var b = new SeqRecord(1, new int[] { 1, 2 }, new int[] { 3 });
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, new SeqRecord(2, new int[] { 1, 2 }, new int[] { 3 }));
    assertNotEquals(a, new SeqRecord(1, new int[] { 1, 2 }));
  }
  
  
  @Test
  public void testPair() {
    var pair = new SeqPair(new int[] { 4 }, new int[] { 5, 6 });
    var record = pair.toRecord(9);
    assertEquals(9, record.id());
    assertEquals(pair, record.toPair());
    assertEquals(2, pair.yLen());
    assertFalse(new SeqPair(new int[] { 4 }).hasY());
  }

}
