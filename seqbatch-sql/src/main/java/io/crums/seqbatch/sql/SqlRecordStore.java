/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.sql;


import static io.crums.seqbatch.SeqBatchConstants.*;
import static io.crums.seqbatch.sql.RecordSchema.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Random;

import io.crums.seqbatch.MissingRecordException;
import io.crums.seqbatch.SeqCodec;
import io.crums.seqbatch.SeqPair;
import io.crums.seqbatch.SeqRecord;
import io.crums.seqbatch.store.CloseableIterator;
import io.crums.seqbatch.store.IndexedRecordStore;
import io.crums.seqbatch.store.LengthOrdering;
import io.crums.seqbatch.store.LengthRow;
import io.crums.seqbatch.store.ReadOrder;

/**
 * Record store backed by a single-file H2 database. See {@linkplain RecordSchema}.
 *
 * <h2>Files</h2>
 * <p>
 * The store's path is the H2 database file itself, and its name must end with
 * {@linkplain #H2_EXT}. Stores are created all at once by
 * {@linkplain #write(File, Iterator)} and are not modified thereafter.
 * </p>
 * <h2>Read Order</h2>
 * <p>
 * A pass first loads the {@code (id, x_len, y_len)} projection, orders it per the
 * configured {@linkplain ReadOrder} (with length jitter), and then fetches the
 * records themselves in chunks of {@linkplain #FETCH_SIZE}.
 * </p>
 */
public class SqlRecordStore implements IndexedRecordStore {

  /**
   * Required file name extension.
   */
  public final static String H2_EXT = ".mv.db";

  /**
   * Number of records fetched per query.
   */
  public final static int FETCH_SIZE = 512;

  /**
   * Number of rows inserted per JDBC batch.
   */
  final static int INSERT_BATCH = 1000;


  /**
   * Read options.
   *
   * @param order       pass order
   * @param lenRand     length jitter window (&ge; 1); 1 means no jitter
   * @param maxSrcLen   source length limit
   * @param maxTgtLen   target length limit
   * @param truncate    if {@code true}, over-length records are truncated; otherwise, skipped
   */
  public record ReadOptions(
      ReadOrder order, int lenRand, int maxSrcLen, int maxTgtLen, boolean truncate) {

    public final static ReadOptions DEFAULT =
        new ReadOptions(ReadOrder.RANDOM, DEF_LEN_RAND, DEF_MAX_SRC_LEN, DEF_MAX_TGT_LEN, false);

    public ReadOptions {
      Objects.requireNonNull(order, "null order");
      if (lenRand < 1)
        throw new IllegalArgumentException("lenRand " + lenRand);
      if (maxSrcLen < 1 || maxTgtLen < 1)
        throw new IllegalArgumentException(
            "maxSrcLen " + maxSrcLen + ", maxTgtLen " + maxTgtLen);
    }

    public ReadOptions order(ReadOrder order) {
      return new ReadOptions(order, lenRand, maxSrcLen, maxTgtLen, truncate);
    }
  }



  /**
   * Returns the JDBC URL for the given database file.
   *
   * @param path   name ends with {@linkplain #H2_EXT}
   */
  public static String jdbcUrl(File path) {
    String name = path.getAbsolutePath();
    if (!name.endsWith(H2_EXT))
      throw new IllegalArgumentException(
          "H2 store file name must end with '" + H2_EXT + "': " + path);
    return "jdbc:h2:" + name.substring(0, name.length() - H2_EXT.length());
  }



  /**
   * Writes the given records to a new store at the given path. An existing store
   * at that path is overwritten (with a warning). The store is first written to a
   * temporary database in the same directory, and then moved into place.
   *
   * @param path      the database file
   * @param records   records with no target are written with a {@code y_len} of -1
   *
   * @return the number of records written
   */
  public static long write(File path, Iterator<SeqPair> records) throws IOException {
    Objects.requireNonNull(records, "null records");
    jdbcUrl(path);
    if (path.exists())
      logWarning("overwriting " + path);

    File dir = path.getAbsoluteFile().getParentFile();
    if (!dir.isDirectory() && !dir.mkdirs())
      throw new IOException("failed to create directory " + dir);

    String base = path.getName();
    base = base.substring(0, base.length() - H2_EXT.length());
    String tmpBase = base + ".tmp" + System.nanoTime();
    File tmp = new File(dir, tmpBase + H2_EXT);

    long count = 0;
    try {
      try (Connection con = DriverManager.getConnection(jdbcUrl(tmp))) {
        con.setAutoCommit(false);
        try (Statement stmt = con.createStatement()) {
          stmt.execute(CREATE_TABLE);
        }
        try (PreparedStatement insert = con.prepareStatement(INSERT)) {
          while (records.hasNext()) {
            SeqPair pair = records.next();
            insert.setBytes(1, SeqCodec.encode(pair.x()));
            if (pair.hasY())
              insert.setBytes(2, SeqCodec.encode(pair.y()));
            else
              insert.setNull(2, Types.BLOB);
            insert.setInt(3, pair.xLen());
            insert.setInt(4, pair.hasY() ? pair.yLen() : NO_Y_LEN);
            insert.addBatch();
            if (++count % INSERT_BATCH == 0) {
              insert.executeBatch();
              logDebug("inserted " + count + " records");
            }
          }
          if (count % INSERT_BATCH != 0)
            insert.executeBatch();
        }
        con.commit();
      } catch (SQLException sqx) {
        throw new SqlStoreException("on writing " + path + " (after " + count + " records)", sqx);
      }

      Files.move(tmp.toPath(), path.toPath(), StandardCopyOption.REPLACE_EXISTING);

    } finally {
      Files.deleteIfExists(tmp.toPath());
      Files.deleteIfExists(new File(dir, tmpBase + ".trace.db").toPath());
    }
    logInfo("wrote " + count + " records to " + path);
    return count;
  }





  private final File path;
  private final ReadOptions options;
  private final Random random;
  private final Connection con;
  private final PreparedStatement countStmt;
  private final PreparedStatement lengthsStmt;



  /**
   * Opens an existing store with {@linkplain ReadOptions#DEFAULT default} options.
   */
  public SqlRecordStore(File path) {
    this(path, ReadOptions.DEFAULT, new Random());
  }


  /**
   * Opens an existing store. The schema is validated here.
   *
   * @param path    the database file (must exist)
   * @param options read options
   * @param random  random source for ordering
   *
   * @throws SqlStoreException if the database doesn't have the expected schema
   */
  public SqlRecordStore(File path, ReadOptions options, Random random)
      throws SqlStoreException {

    this.path = Objects.requireNonNull(path, "null path");
    this.options = Objects.requireNonNull(options, "null options");
    this.random = Objects.requireNonNull(random, "null random");
    String url = jdbcUrl(path);
    if (!path.isFile())
      throw new IllegalArgumentException("no such store: " + path);

    Connection con = null;
    try {
      con = DriverManager.getConnection(url + ";IFEXISTS=TRUE");
      con.setReadOnly(true);
      RecordSchema.validate(con);
      this.countStmt = con.prepareStatement(COUNT_ROWS);
      this.lengthsStmt = con.prepareStatement(SELECT_LENGTHS);
      this.con = con;
    } catch (SQLException sqx) {
      closeQuietly(con);
      throw new SqlStoreException("on opening " + path, sqx);
    } catch (RuntimeException rx) {
      closeQuietly(con);
      throw rx;
    }
    logInfo("opened " + path + ", read order " + options.order().symbol());
  }


  private static void closeQuietly(Connection con) {
    if (con == null)
      return;
    try {
      con.close();
    } catch (SQLException sqx) {
      logWarning("ignoring con.close() complaint: " + sqx);
    }
  }


  public File getPath() {
    return path;
  }


  public ReadOptions getOptions() {
    return options;
  }


  @Override
  public synchronized long size() {
    try (ResultSet rs = countStmt.executeQuery()) {
      if (rs.next())
        return rs.getLong(1);
      throw new SqlStoreException("on size(): empty result");
    } catch (SQLException sqx) {
      throw new SqlStoreException("on size()", sqx);
    }
  }


  /**
   * {@inheritDoc}
   * <p>
   * Length orders are jittered per {@linkplain ReadOptions#lenRand()}.
   * </p>
   */
  @Override
  public List<LengthRow> lengthIndex(ReadOrder order) {
    return LengthOrdering.sort(loadLengths(), order, options.lenRand(), random);
  }


  private synchronized List<LengthRow> loadLengths() {
    var rows = new ArrayList<LengthRow>();
    try (ResultSet rs = lengthsStmt.executeQuery()) {
      while (rs.next())
        rows.add(new LengthRow(rs.getLong(1), rs.getInt(2), rs.getInt(3)));
    } catch (SQLException sqx) {
      throw new SqlStoreException("on loading length columns", sqx);
    }
    return rows;
  }


  @Override
  public synchronized List<SeqRecord> getByIds(long[] ids) throws MissingRecordException {
    var found = new HashMap<Long, SeqRecord>(ids.length * 2);

    for (int start = 0; start < ids.length; start += FETCH_SIZE) {
      final int count = Math.min(FETCH_SIZE, ids.length - start);
      try (PreparedStatement select = con.prepareStatement(selectByIds(count))) {
        for (int index = 0; index < count; ++index)
          select.setLong(index + 1, ids[start + index]);
        try (ResultSet rs = select.executeQuery()) {
          while (rs.next()) {
            SeqRecord record = decodeRow(rs);
            found.put(record.id(), record);
          }
        }
      } catch (SQLException sqx) {
        throw new SqlStoreException("on getByIds(): " + ids.length + " ids", sqx);
      }
    }

    var records = new ArrayList<SeqRecord>(ids.length);
    for (long id : ids) {
      SeqRecord record = found.get(id);
      if (record == null)
        throw new MissingRecordException("no record with id " + id + " in " + path);
      records.add(record);
    }
    return records;
  }


  /**
   * Starts a new pass in the configured {@linkplain ReadOptions#order() order}.
   * Records with an empty side are skipped with a warning; over-length records
   * are either truncated or skipped.
   */
  @Override
  public CloseableIterator<SeqRecord> iterator() {
    return new ChunkIterator(lengthIndex(options.order()));
  }


  @Override
  public synchronized void close() {
    closeQuietly(con);
  }


  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + path + "]";
  }



  private class ChunkIterator implements CloseableIterator<SeqRecord> {

    private final List<LengthRow> order;
    private int cursor;
    private Iterator<SeqRecord> chunk = Collections.emptyIterator();
    private SeqRecord next;

    ChunkIterator(List<LengthRow> order) {
      this.order = order;
    }

    @Override
    public boolean hasNext() {
      while (next == null) {
        if (!chunk.hasNext()) {
          if (cursor == order.size())
            return false;
          chunk = fetchChunk().iterator();
          continue;
        }
        next = admit(chunk.next());
      }
      return true;
    }

    private List<SeqRecord> fetchChunk() {
      int end = Math.min(order.size(), cursor + FETCH_SIZE);
      long[] ids = new long[end - cursor];
      for (int index = 0; index < ids.length; ++index)
        ids[index] = order.get(cursor + index).id();
      cursor = end;
      return getByIds(ids);
    }

    /** Returns {@code null} if the record is skipped. */
    private SeqRecord admit(SeqRecord record) {
      if (record.hasEmptySide()) {
        logWarning(
            "skipping record " + record.id() + ": either source or target is empty (x_len:" +
            record.xLen() + " y_len:" + record.yLen() + ")");
        return null;
      }
      if (record.exceeds(options.maxSrcLen(), options.maxTgtLen())) {
        if (!options.truncate())
          return null;
        return record.truncate(options.maxSrcLen(), options.maxTgtLen());
      }
      return record;
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
      cursor = order.size();
      chunk = Collections.emptyIterator();
      next = null;
    }
  }

}
