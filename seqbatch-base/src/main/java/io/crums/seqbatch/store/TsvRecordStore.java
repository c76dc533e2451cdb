/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.store;


import static io.crums.seqbatch.SeqBatchConstants.*;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Random;

import io.crums.seqbatch.SeqBatchException;
import io.crums.seqbatch.SeqPair;
import io.crums.seqbatch.SeqRecord;
import io.crums.seqbatch.prep.Tokenizer;

/**
 * Flat-file {@linkplain RecordStore}. One record per line, UTF-8: a source
 * field, and optionally a tab followed by a target field; each field is a list
 * of whitespace-separated base-10 integers. A record's id is its 0-based line
 * number.
 *
 * <h2>Memory Policy</h2>
 * <p>
 * If the records are held in memory (implied when either shuffling or
 * longest-first is on), the file is read once, at construction, and every
 * pass replays the in-memory list. The first pass shuffles (if configured) and then
 * sorts by length descending (if configured); subsequent passes only reshuffle.
 * Otherwise, each pass streams the file from disk in constant memory, in file
 * order.
 * </p>
 * <h2>Filtering</h2>
 * <p>
 * Over-length records are either truncated or skipped, per {@linkplain Options#truncate()}.
 * Records with an empty side (after truncation) are skipped with a warning.
 * None of these are errors. An unparseable integer, however, is.
 * </p>
 */
public class TsvRecordStore implements RecordStore {

  /**
   * Construction options.
   *
   * @param inMem         hold the records in memory
   * @param shuffle       shuffle the records before every pass (implies {@code inMem})
   * @param longestFirst  on the first pass, sort by target length (source length, if
   *                      no target) descending (implies {@code inMem})
   * @param maxSrcLen     maximum source length (&ge; 1)
   * @param maxTgtLen     maximum target length (&ge; 1)
   * @param truncate      if {@code true}, over-length sequences are truncated; otherwise
   *                      the records are skipped
   */
  public record Options(
      boolean inMem, boolean shuffle, boolean longestFirst,
      int maxSrcLen, int maxTgtLen, boolean truncate) {

    /**
     * Streaming, file order, no truncation, max lengths 512.
     */
    public final static Options DEFAULT =
        new Options(false, false, false, DEF_MAX_SRC_LEN, DEF_MAX_TGT_LEN, false);

    public Options {
      if (maxSrcLen < 1 || maxTgtLen < 1)
        throw new IllegalArgumentException(
            "maxSrcLen " + maxSrcLen + ", maxTgtLen " + maxTgtLen);
    }

    /** Returns {@code true} if records are to be held in memory. */
    public boolean holdInMemory() {
      return inMem || shuffle || longestFirst;
    }

    public Options shuffle(boolean shuffle) {
      return new Options(inMem, shuffle, longestFirst, maxSrcLen, maxTgtLen, truncate);
    }

    public Options longestFirst(boolean longestFirst) {
      return new Options(inMem, shuffle, longestFirst, maxSrcLen, maxTgtLen, truncate);
    }

    public Options inMem(boolean inMem) {
      return new Options(inMem, shuffle, longestFirst, maxSrcLen, maxTgtLen, truncate);
    }

    public Options maxLengths(int maxSrcLen, int maxTgtLen) {
      return new Options(inMem, shuffle, longestFirst, maxSrcLen, maxTgtLen, truncate);
    }

    public Options truncate(boolean truncate) {
      return new Options(inMem, shuffle, longestFirst, maxSrcLen, maxTgtLen, truncate);
    }
  }



  //   S T A T I C   W R I T E R S

  /**
   * Writes the given pairs to the given file in the flat-file format.
   * Pairs without a target are written without a tab.
   *
   * @return the number of records written
   */
  public static long writeParallel(Iterable<SeqPair> records, File file) throws IOException {
    logInfo("storing data at " + file);
    long count = 0;
    try (BufferedWriter writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      for (SeqPair pair : records) {
        writer.write(joinInts(pair.x()));
        if (pair.hasY()) {
          writer.write('\t');
          writer.write(joinInts(pair.y()));
        }
        writer.write('\n');
        ++count;
      }
    }
    return count;
  }


  /**
   * Writes the given (source only) sequences to the given file, one per line.
   *
   * @return the number of records written
   */
  public static long writeMono(Iterable<int[]> records, File file) throws IOException {
    logInfo("storing data at " + file);
    long count = 0;
    try (BufferedWriter writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      for (int[] seq : records) {
        writer.write(joinInts(seq));
        writer.write('\n');
        ++count;
      }
    }
    return count;
  }


  private static String joinInts(int[] seq) {
    var s = new StringBuilder(seq.length * 4);
    for (int index = 0; index < seq.length; ++index) {
      if (index != 0)
        s.append(' ');
      s.append(seq[index]);
    }
    return s.toString();
  }






  //   I N S T A N C E    M E M B E R S


  private final File file;
  private final Options options;
  private final Random random;
  private final long size;

  /** {@code null}, if streaming. */
  private List<SeqRecord> mem;

  private int passes;



  /**
   * Creates a streaming instance with default options.
   */
  public TsvRecordStore(File file) throws IOException {
    this(file, Options.DEFAULT, new Random());
  }


  /**
   * @param file      the flat-file
   * @param options   construction options
   * @param random    random source used for shuffling
   */
  public TsvRecordStore(File file, Options options, Random random) throws IOException {
    this.file = Objects.requireNonNull(file, "null file");
    this.options = Objects.requireNonNull(options, "null options");
    this.random = Objects.requireNonNull(random, "null random");
    if (!file.isFile())
      throw new IllegalArgumentException("not a file: " + file);

    if (options.holdInMemory()) {
      var records = new ArrayList<SeqRecord>();
      try (var iter = new FileIterator()) {
        while (iter.hasNext())
          records.add(iter.next());
      } catch (UncheckedIOException uix) {
        throw uix.getCause();
      }
      this.mem = records;
      this.size = records.size();
    } else {
      this.mem = null;
      this.size = lineCount(file);
    }
  }


  private static long lineCount(File file) throws IOException {
    long count = 0;
    try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      while (reader.readLine() != null)
        ++count;
    }
    return count;
  }


  public File getFile() {
    return file;
  }


  public Options getOptions() {
    return options;
  }


  /**
   * Returns the number of passes started so far.
   */
  public int passes() {
    return passes;
  }


  /**
   * Returns the number of in-memory records, if held in memory; the file's
   * line count, otherwise.
   */
  @Override
  public long size() {
    return size;
  }


  @Override
  public CloseableIterator<SeqRecord> iterator() {
    if (mem == null) {
      ++passes;
      return new FileIterator();
    }

    List<SeqRecord> pass = mem;
    if (options.shuffle()) {
      if (passes == 0)
        logInfo("shuffling the data..");
      // fresh list; iterators from earlier passes keep theirs
      pass = new ArrayList<>(pass);
      Collections.shuffle(pass, random);
    }
    if (options.longestFirst() && passes == 0) {
      logInfo("sorting the dataset by length of target sequence");
      pass = new ArrayList<>(pass);
      pass.sort(
          Comparator.comparingInt(TsvRecordStore::sortLength).reversed());
      if (!pass.isEmpty())
        logInfo("longest source seq length: " + pass.get(0).xLen());
    }
    mem = pass;
    ++passes;
    return CloseableIterator.of(Collections.unmodifiableList(pass));
  }


  private static int sortLength(SeqRecord record) {
    return record.hasY() ? record.yLen() : record.xLen();
  }



  /**
   * Parses the given line. Returns {@code null} if the record is filtered out.
   */
  SeqRecord parseLine(String line, long lineNo) {
    int tab = line.indexOf('\t');
    int[] x;
    int[] y;
    try {
      x = Tokenizer.INTEGERS.tokenize(tab == -1 ? line : line.substring(0, tab));
      y = tab == -1 ? null : Tokenizer.INTEGERS.tokenize(line.substring(tab + 1));
    } catch (NumberFormatException nfx) {
      throw new SeqBatchException(
          "malformed integer at " + file + ":" + (lineNo + 1) + " -- " + nfx.getMessage(), nfx);
    }
    var record = new SeqRecord(lineNo, x, y);
    if (options.truncate())
      record = record.truncate(options.maxSrcLen(), options.maxTgtLen());
    else if (record.exceeds(options.maxSrcLen(), options.maxTgtLen()))
      return null;

    if (record.hasEmptySide()) {
      logWarning(
          "ignoring an empty record (line " + (lineNo + 1) + ") x:" + record.xLen() +
          " y:" + record.yLen());
      return null;
    }
    return record;
  }


  /**
   * Streams (filtered) records from the file.
   */
  private class FileIterator implements CloseableIterator<SeqRecord> {

    private BufferedReader reader;
    private long lineNo;
    private SeqRecord next;

    FileIterator() {
      try {
        reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
      } catch (IOException iox) {
        throw new UncheckedIOException("on opening " + file, iox);
      }
    }

    @Override
    public boolean hasNext() {
      while (next == null && reader != null) {
        String line;
        try {
          line = reader.readLine();
        } catch (IOException iox) {
          close();
          throw new UncheckedIOException("on reading " + file + " at line " + (lineNo + 1), iox);
        }
        if (line == null) {
          close();
          break;
        }
        try {
          next = parseLine(line, lineNo++);
        } catch (SeqBatchException sbx) {
          close();
          throw sbx;
        }
      }
      return next != null;
    }

    @Override
    public SeqRecord next() {
      if (!hasNext())
        throw new NoSuchElementException();
      SeqRecord record = next;
      next = null;
      return record;
    }

    @Override
    public void close() {
      if (reader == null)
        return;
      try {
        reader.close();
      } catch (IOException iox) {
        logWarning("ignoring close() complaint on " + file + ": " + iox);
      } finally {
        reader = null;
      }
    }
  }

}
