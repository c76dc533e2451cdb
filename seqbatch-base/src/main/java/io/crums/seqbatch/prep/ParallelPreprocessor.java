/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.prep;


import static io.crums.seqbatch.SeqBatchConstants.logInfo;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import io.crums.seqbatch.CorpusMismatchException;
import io.crums.seqbatch.SeqBatchException;
import io.crums.seqbatch.SeqPair;

/**
 * Tokenizes and length-filters raw corpora into {@linkplain SeqPair}s, fanning the
 * work out over a fixed-size worker pool.
 *
 * <h2>Pipeline</h2>
 * <ol>
 * <li>Raw lines are read on the calling thread. For parallel corpora the two
 * files are zipped strictly line-for-line: unequal line counts are a
 * {@linkplain CorpusMismatchException}, raised before any output is produced.
 * Pairs with a blank side are dropped.</li>
 * <li>The pairs are split into chunks and each chunk is handed to a worker, which
 * tokenizes both sides and applies the {@linkplain LengthPolicy}. Workers share
 * no mutable state. A filtered-out pair comes back as {@code null}.</li>
 * <li>The caller drops the {@code null}s. Input order is preserved.</li>
 * </ol>
 */
public class ParallelPreprocessor {

  /**
   * Number of pairs handed to a worker at a time.
   */
  public final static int CHUNK_SIZE = 1024;


  /**
   * Returns the number of available processors.
   */
  public static int defaultWorkers() {
    return Runtime.getRuntime().availableProcessors();
  }


  private final Tokenizer srcTokenizer;
  private final Tokenizer tgtTokenizer;
  private final LengthPolicy policy;
  private final int workers;


  /**
   * @param srcTokenizer  source side tokenizer (thread-safe)
   * @param tgtTokenizer  target side tokenizer (thread-safe)
   * @param policy        length policy
   * @param workers       worker pool size (&ge; 1)
   */
  public ParallelPreprocessor(
      Tokenizer srcTokenizer, Tokenizer tgtTokenizer, LengthPolicy policy, int workers) {
    this.srcTokenizer = Objects.requireNonNull(srcTokenizer, "null srcTokenizer");
    this.tgtTokenizer = Objects.requireNonNull(tgtTokenizer, "null tgtTokenizer");
    this.policy = Objects.requireNonNull(policy, "null policy");
    if (workers < 1)
      throw new IllegalArgumentException("workers " + workers);
    this.workers = workers;
  }


  public LengthPolicy policy() {
    return policy;
  }


  public int workers() {
    return workers;
  }



  /**
   * Reads, tokenizes and filters the given parallel corpus.
   *
   * @param srcFile source side, one sentence per line
   * @param tgtFile target side, line-aligned with {@code srcFile}
   *
   * @return the surviving pairs, in corpus order
   *
   * @throws CorpusMismatchException if the files have unequal line counts
   */
  public List<SeqPair> processParallel(File srcFile, File tgtFile)
      throws IOException, CorpusMismatchException {

    List<String[]> raw = readRawParallelLines(srcFile, tgtFile);
    logInfo("processing " + raw.size() + " parallel records using " + workers + " workers");

    List<SeqPair> pairs = fanOut(raw, this::tokenizePair);
    logInfo(pairs.size() + " of " + raw.size() + " parallel records kept");
    return pairs;
  }


  /**
   * Reads, tokenizes and filters the given monolingual corpus using the
   * source tokenizer and source max length.
   *
   * @return the surviving sequences, in corpus order
   */
  public List<int[]> processMono(File file) throws IOException {
    var raw = new ArrayList<String[]>();
    try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      for (String line = reader.readLine(); line != null; line = reader.readLine()) {
        String text = line.strip();
        if (!text.isEmpty())
          raw.add(new String[] { text });
      }
    }
    List<SeqPair> seqs = fanOut(raw, this::tokenizeMono);
    var out = new ArrayList<int[]>(seqs.size());
    for (SeqPair seq : seqs)
      out.add(seq.x());
    logInfo(out.size() + " of " + raw.size() + " mono records kept");
    return out;
  }



  /**
   * Reads the two files line for line.
   *
   * @return stripped {@code [src, tgt]} line pairs, with pairs that have a blank
   *         side dropped
   *
   * @throws CorpusMismatchException if the files have unequal line counts
   */
  public static List<String[]> readRawParallelLines(File srcFile, File tgtFile)
      throws IOException, CorpusMismatchException {

    var pairs = new ArrayList<String[]>();
    try (BufferedReader src = Files.newBufferedReader(srcFile.toPath(), StandardCharsets.UTF_8);
         BufferedReader tgt = Files.newBufferedReader(tgtFile.toPath(), StandardCharsets.UTF_8)) {

      long lineNo = 0;
      while (true) {
        String srcLine = src.readLine();
        String tgtLine = tgt.readLine();
        if (srcLine == null || tgtLine == null) {
          if (srcLine != null || tgtLine != null)
            throw new CorpusMismatchException(
                (srcLine == null ? srcFile : tgtFile) + " ended after " + lineNo +
                " lines, but " + (srcLine == null ? tgtFile : srcFile) + " has more");
          break;
        }
        ++lineNo;
        String s = srcLine.strip();
        String t = tgtLine.strip();
        if (!s.isEmpty() && !t.isEmpty())
          pairs.add(new String[] { s, t });
      }
    }
    return pairs;
  }



  private SeqPair tokenizePair(String[] raw) {
    int[][] pair = policy.apply(
        srcTokenizer.tokenize(raw[0]),
        tgtTokenizer.tokenize(raw[1]));
    if (pair == null || pair[0].length == 0 || pair[1].length == 0)
      return null;
    return new SeqPair(pair[0], pair[1]);
  }


  private SeqPair tokenizeMono(String[] raw) {
    int[] seq = policy.applyMono(srcTokenizer.tokenize(raw[0]));
    return seq == null || seq.length == 0 ? null : new SeqPair(seq);
  }


  @FunctionalInterface
  private interface Task {
    /** Returns {@code null} if filtered out. */
    SeqPair apply(String[] raw);
  }


  private List<SeqPair> fanOut(List<String[]> raw, Task task) {
    if (raw.isEmpty())
      return new ArrayList<>();

    ExecutorService pool = Executors.newFixedThreadPool(workers);
    try {
      var futures = new ArrayList<Future<List<SeqPair>>>();
      for (int start = 0; start < raw.size(); start += CHUNK_SIZE) {
        List<String[]> chunk = raw.subList(start, Math.min(start + CHUNK_SIZE, raw.size()));
        Callable<List<SeqPair>> work = () -> {
          var out = new ArrayList<SeqPair>(chunk.size());
          for (String[] r : chunk)
            out.add(task.apply(r));
          return out;
        };
        futures.add(pool.submit(work));
      }

      var compacted = new ArrayList<SeqPair>(raw.size());
      for (var future : futures)
        for (SeqPair pair : future.get())
          if (pair != null)
            compacted.add(pair);
      return compacted;

    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException rx)
        throw rx;
      throw new SeqBatchException("worker failed: " + cause, cause);

    } catch (InterruptedException ix) {
      Thread.currentThread().interrupt();
      throw new SeqBatchException("interrupted while preprocessing", ix);

    } finally {
      pool.shutdownNow();
    }
  }

}
