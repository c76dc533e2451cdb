/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.cache;


import static io.crums.seqbatch.SeqBatchConstants.*;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;

import io.crums.seqbatch.ByteFormatException;
import io.crums.seqbatch.DuplicateIdException;
import io.crums.seqbatch.MissingRecordException;
import io.crums.seqbatch.SeqCodec;
import io.crums.seqbatch.SeqRecord;
import io.crums.seqbatch.store.CloseableIterator;
import io.crums.seqbatch.store.IndexedRecordStore;
import io.crums.seqbatch.store.LengthOrdering;
import io.crums.seqbatch.store.LengthRow;
import io.crums.seqbatch.store.ReadOrder;
import io.crums.seqbatch.store.RecordStore;

/**
 * An in-memory copy of a {@linkplain RecordStore}, indexed by record id.
 * Wrapping a store in this class turns any backend into an
 * {@linkplain IndexedRecordStore}.
 *
 * <h2>Sorting</h2>
 * <p>
 * {@linkplain #lengthIndex(ReadOrder)} sorts exactly (no jitter).
 * {@linkplain ReadOrder#RANDOM RANDOM} is a shuffle using the instance's random source, and
 * {@linkplain ReadOrder#EQ_LEN_RAND_BATCH EQ_LEN_RAND_BATCH} sorts by target length
 * descending.
 * </p>
 * <h2>Snapshots</h2>
 * <p>
 * An instance can be saved to, and loaded from, a binary snapshot file
 * keyed by the path of the store it was built from. See
 * {@linkplain #loadOrBuild(File, Supplier, LoadObserver, Random)}. The key is
 * just the path: if the store at that path changes, the snapshot goes stale
 * undetected. Delete the snapshot file to force a rebuild.
 * </p>
 */
public class InMemoryStore implements IndexedRecordStore {

  /**
   * Snapshot file header magic bytes.
   */
  private final static byte[] MAGIC = { 'S', 'B', 'M', 'E', 'M' };

  private final static byte VERSION = 1;



  /**
   * Returns the snapshot file for the store at the given path.
   *
   * @return {@code <source path>.memdb}
   */
  public static File snapshotFile(File source) {
    return new File(source.getPath() + MEMDB_EXT);
  }


  /**
   * Loads the snapshot for the given source path, if it exists; otherwise, builds
   * a new instance from the store supplied, and saves its snapshot.
   *
   * @param source      path to the source store (the snapshot's key)
   * @param store       invoked only if there's no snapshot. The store is closed
   *                    after it's read
   * @param observer    load observer (may be {@code null})
   * @param random      random source for {@linkplain ReadOrder#RANDOM} sorts
   */
  public static InMemoryStore loadOrBuild(
      File source, Supplier<? extends RecordStore> store, LoadObserver observer, Random random)
          throws IOException {

    File snapshot = snapshotFile(source);
    String key = snapshotKey(source);
    if (snapshot.isFile()) {
      logInfo("loading from " + snapshot);
      var loaded = load(snapshot, random);
      if (key.equals(loaded.sourceKey))
        return loaded;
      logWarning(
          "snapshot " + snapshot + " was built from " + loaded.sourceKey +
          ", not " + key + "; rebuilding");
    }

    InMemoryStore mem;
    try (RecordStore src = store.get()) {
      mem = new InMemoryStore(src, observer, random, key);
    }
    logInfo("saving in-memory store to " + snapshot);
    mem.save(snapshot);
    return mem;
  }


  private static String snapshotKey(File source) {
    return source.getAbsoluteFile().toPath().normalize().toString();
  }



  /**
   * Loads an instance from the given snapshot file.
   *
   * @throws ByteFormatException if the file is not a snapshot
   */
  public static InMemoryStore load(File snapshot, Random random) throws IOException {
    try (var in = new DataInputStream(
        new BufferedInputStream(Files.newInputStream(snapshot.toPath())))) {

      byte[] magic = new byte[MAGIC.length];
      in.readFully(magic);
      if (!Arrays.equals(MAGIC, magic))
        throw new ByteFormatException("not a snapshot file: " + snapshot);
      byte version = in.readByte();
      if (version != VERSION)
        throw new ByteFormatException(
            "unsupported snapshot version " + version + ": " + snapshot);

      String key = in.readUTF();
      if (key.isEmpty())
        key = null;

      final long count = in.readLong();
      if (count < 0 || count > Integer.MAX_VALUE)
        throw new ByteFormatException("record count " + count + " in " + snapshot);

      var records = new ArrayList<SeqRecord>((int) count);
      for (long index = 0; index < count; ++index) {
        long id = in.readLong();
        int[] x = readSeq(in);
        int[] y = in.readBoolean() ? readSeq(in) : null;
        records.add(new SeqRecord(id, x, y));
      }
      return new InMemoryStore(records, LoadObserver.NOOP, random, key);

    } catch (EOFException eofx) {
      throw new ByteFormatException("truncated snapshot file: " + snapshot, eofx);
    }
  }


  private static int[] readSeq(DataInputStream in) throws IOException {
    int len = in.readInt();
    if (len < 0)
      throw new ByteFormatException("negative encoded length " + len);
    byte[] bytes = new byte[len];
    in.readFully(bytes);
    return SeqCodec.decode(bytes);
  }


  private static void writeSeq(int[] seq, DataOutputStream out) throws IOException {
    byte[] bytes = SeqCodec.encode(seq);
    out.writeInt(bytes.length);
    out.write(bytes);
  }






  //   I N S T A N C E    M E M B E R S



  private final List<SeqRecord> data;
  private final Map<Long, Integer> ids;
  private final Random random;

  /** Snapshot key. May be {@code null}. */
  private final String sourceKey;



  /**
   * Materializes the given store with a fresh random source.
   *
   * @param source    the store (not closed by this constructor)
   * @param observer  load observer (may be {@code null})
   */
  public InMemoryStore(RecordStore source, LoadObserver observer) {
    this(source, observer, new Random());
  }


  /**
   * Materializes the given records.
   *
   * @param source    a pass over these records is loaded
   * @param observer  load observer (may be {@code null})
   * @param random    random source for {@linkplain ReadOrder#RANDOM} sorts
   *
   * @throws DuplicateIdException if 2 records share the same id
   */
  public InMemoryStore(Iterable<SeqRecord> source, LoadObserver observer, Random random)
      throws DuplicateIdException {
    this(source, observer, random, null);
  }


  private InMemoryStore(
      Iterable<SeqRecord> source, LoadObserver observer, Random random, String sourceKey) {

    Objects.requireNonNull(source, "null source");
    this.random = Objects.requireNonNull(random, "null random");
    this.sourceKey = sourceKey;
    if (observer == null)
      observer = LoadObserver.NOOP;

    var records = new ArrayList<SeqRecord>();
    var index = new HashMap<Long, Integer>();
    final int interval = Math.max(1, observer.interval());

    var iter = source.iterator();
    try {
      while (iter.hasNext()) {
        SeqRecord record = iter.next();
        Integer prev = index.putIfAbsent(record.id(), records.size());
        if (prev != null)
          throw new DuplicateIdException(
              "record with id " + record.id() + " is a duplicate (record #" +
              records.size() + " and #" + prev + ")");
        records.add(record);
        if (records.size() % interval == 0)
          observer.loaded(records.size(), usedMemory());
      }
    } finally {
      if (iter instanceof AutoCloseable closeable)
        closeQuietly(closeable);
    }
    observer.loaded(records.size(), usedMemory());
    logInfo("total=" + records.size() + " records; memory used " + (usedMemory() >> 20) + " MB");

    this.data = Collections.unmodifiableList(records);
    this.ids = index;
  }


  private static long usedMemory() {
    var runtime = Runtime.getRuntime();
    return runtime.totalMemory() - runtime.freeMemory();
  }


  private static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception x) {
      logWarning("ignoring close() complaint: " + x);
    }
  }



  /**
   * Saves this instance to the given snapshot file. The file is first written
   * to a temp file in the same directory and then moved into place.
   */
  public void save(File snapshot) throws IOException {
    File dir = snapshot.getAbsoluteFile().getParentFile();
    File tmp = File.createTempFile(snapshot.getName(), ".tmp", dir);
    try {
      try (var out = new DataOutputStream(
          new BufferedOutputStream(Files.newOutputStream(tmp.toPath())))) {
        out.write(MAGIC);
        out.writeByte(VERSION);
        out.writeUTF(sourceKey == null ? "" : sourceKey);
        out.writeLong(data.size());
        for (SeqRecord record : data) {
          out.writeLong(record.id());
          writeSeq(record.x(), out);
          out.writeBoolean(record.hasY());
          if (record.hasY())
            writeSeq(record.y(), out);
        }
      }
      Files.move(tmp.toPath(), snapshot.toPath(), StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(tmp.toPath());
    }
  }


  /**
   * Returns the path key of the store this instance was built from, if any.
   *
   * @return may be {@code null}
   */
  public String sourceKey() {
    return sourceKey;
  }


  @Override
  public long size() {
    return data.size();
  }


  /**
   * Iterates the records in load order.
   */
  @Override
  public CloseableIterator<SeqRecord> iterator() {
    return CloseableIterator.of(data);
  }


  @Override
  public List<LengthRow> lengthIndex(ReadOrder order) {
    var rows = new ArrayList<LengthRow>(data.size());
    for (SeqRecord record : data)
      rows.add(LengthRow.of(record));
    return LengthOrdering.sort(rows, order, 1, random);
  }


  @Override
  public List<SeqRecord> getByIds(long[] recordIds) throws MissingRecordException {
    var records = new ArrayList<SeqRecord>(recordIds.length);
    for (long id : recordIds) {
      Integer index = ids.get(id);
      if (index == null)
        throw new MissingRecordException("no record with id " + id);
      records.add(data.get(index));
    }
    return records;
  }

}
