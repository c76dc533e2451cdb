/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * Binary encoding of variable length integer sequences. Used for the
 * sequence columns of the indexed store and in in-memory snapshots.
 * 
 * <h2>Format</h2>
 * <p>
 * The encoding is self-describing:
 * </p>
 * <pre>
 *    MAGIC    (1 byte: 0x53)
 *    COUNT    (unsigned varint)
 *    VALUES   (COUNT zig-zag varints)
 * </pre>
 * <p>
 * Varints are little-endian base-128 groups (7 bits per byte, high bit set
 * on all but the last byte). Zig-zag mapping keeps small negative values
 * (rare in token ids, but legal) short.
 * </p>
 */
public class SeqCodec {
  
  /**
   * Leading byte of every encoded sequence.
   */
  public final static byte MAGIC = 0x53;
  
  private final static int MAX_VARINT_BYTES = 5;
  
  
  private SeqCodec() {  }
  
  
  /**
   * Encodes the given sequence.
   * 
   * @return a new array containing the encoding
   */
  public static byte[] encode(int[] seq) {
    ByteBuffer buffer = ByteBuffer.allocate(encodedSize(seq));
    write(seq, buffer);
    return buffer.array();
  }
  
  
  /**
   * Returns the number of bytes {@linkplain #encode(int[])} generates for the
   * given sequence.
   */
  public static int encodedSize(int[] seq) {
    int size = 1 + varintSize(seq.length);
    for (int value : seq)
      size += varintSize(zigZag(value));
    return size;
  }
  
  
  /**
   * Writes the encoding of the given sequence to the given buffer, advancing
   * its position.
   * 
   * @return the buffer
   */
  public static ByteBuffer write(int[] seq, ByteBuffer out) {
    out.put(MAGIC);
    writeVarint(seq.length, out);
    for (int value : seq)
      writeVarint(zigZag(value), out);
    return out;
  }
  
  
  /**
   * Decodes the given bytes. The entire array must be consumed.
   * 
   * @throws ByteFormatException if the bytes are not a valid encoding
   */
  public static int[] decode(byte[] bytes) throws ByteFormatException {
    ByteBuffer in = ByteBuffer.wrap(bytes);
    int[] seq = read(in);
    if (in.hasRemaining())
      throw new ByteFormatException(
          in.remaining() + " trailing bytes after sequence of length " + seq.length);
    return seq;
  }
  
  
  /**
   * Reads an encoded sequence from the given buffer, advancing its position.
   * 
   * @throws ByteFormatException if the bytes are not a valid encoding
   */
  public static int[] read(ByteBuffer in) throws ByteFormatException {
    try {
      byte magic = in.get();
      if (magic != MAGIC)
        throw new ByteFormatException(
            "expected magic 0x" + Integer.toHexString(MAGIC) + "; actual 0x" +
            Integer.toHexString(0xff & magic));
      int count = readVarint(in);
      // each value takes at least one byte
      if (count < 0 || count > in.remaining())
        throw new ByteFormatException(
            "count " + count + " with " + in.remaining() + " bytes remaining");
      int[] seq = new int[count];
      for (int index = 0; index < count; ++index)
        seq[index] = unZigZag(readVarint(in));
      return seq;
    
    } catch (BufferUnderflowException bux) {
      throw new ByteFormatException("truncated sequence encoding", bux);
    }
  }
  
  
  
  static int zigZag(int value) {
    return (value << 1) ^ (value >> 31);
  }
  
  static int unZigZag(int value) {
    return (value >>> 1) ^ -(value & 1);
  }
  
  
  private static int varintSize(int value) {
    int size = 1;
    while ((value & ~0x7f) != 0) {
      value >>>= 7;
      ++size;
    }
    return size;
  }
  
  
  private static void writeVarint(int value, ByteBuffer out) {
    while ((value & ~0x7f) != 0) {
      out.put((byte) ((value & 0x7f) | 0x80));
      value >>>= 7;
    }
    out.put((byte) value);
  }
  
  
  private static int readVarint(ByteBuffer in) {
    int value = 0;
    for (int index = 0; index < MAX_VARINT_BYTES; ++index) {
      int b = in.get();
      value |= (b & 0x7f) << (7 * index);
      if ((b & 0x80) == 0)
        return value;
    }
    throw new ByteFormatException("varint longer than " + MAX_VARINT_BYTES + " bytes");
  }

}
