/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.sql;


import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import io.crums.seqbatch.SeqCodec;
import io.crums.seqbatch.SeqRecord;

/**
 * Schema of the single table backing a {@linkplain SqlRecordStore}.
 *
 * <h2>Schema</h2>
 * <pre>
 *
 * {@code CREATE TABLE data
 *  (id BIGINT NOT NULL AUTO_INCREMENT,
 *   x BLOB NOT NULL,
 *   y BLOB,
 *   x_len INT NOT NULL,
 *   y_len INT NOT NULL,
 *   PRIMARY KEY (id)
 *  )}
 * </pre>
 * <p>
 * The {@code x} and {@code y} sequences are stored in {@linkplain SeqCodec} encoding.
 * A record without a target has a {@code NULL} {@code y} and a {@code y_len} of -1.
 * The length columns are redundant, but they allow batches to be planned without
 * reading (or decoding) any sequence.
 * </p>
 * <h3>Decoding</h3>
 * <p>
 * Rows are decoded by fixed column position. The column set is checked once, when the
 * store is opened ({@linkplain #validate(Connection)}): a table with unknown or
 * missing columns is rejected then, rather than failing (or worse, not failing) row
 * by row.
 * </p>
 */
public class RecordSchema {

  public final static String TABLE = "data";

  public final static String ID = "id";
  public final static String X = "x";
  public final static String Y = "y";
  public final static String X_LEN = "x_len";
  public final static String Y_LEN = "y_len";

  /**
   * The columns, in table order.
   */
  public final static List<String> COLUMNS = List.of(ID, X, Y, X_LEN, Y_LEN);


  public final static String CREATE_TABLE =
      """
      CREATE TABLE data (
        id BIGINT NOT NULL AUTO_INCREMENT,
        x BLOB NOT NULL,
        y BLOB,
        x_len INT NOT NULL,
        y_len INT NOT NULL,
        PRIMARY KEY (id)
      )""";

  public final static String INSERT =
      "INSERT INTO " + TABLE + " (" + X + ", " + Y + ", " + X_LEN + ", " + Y_LEN +
      ") VALUES (?, ?, ?, ?)";

  public final static String COUNT_ROWS =
      "SELECT COUNT(*) FROM " + TABLE;

  public final static String SELECT_LENGTHS =
      "SELECT " + ID + ", " + X_LEN + ", " + Y_LEN + " FROM " + TABLE + " ORDER BY " + ID;

  /** Column positions in the {@linkplain #selectByIds(int) select-by-ids} query. */
  final static int ID_COL = 1;
  final static int X_COL = 2;
  final static int Y_COL = 3;



  private RecordSchema() {  }


  /**
   * Returns a select-by-id query with the given number of {@code ?} parameters.
   */
  public static String selectByIds(int count) {
    if (count < 1)
      throw new IllegalArgumentException("count " + count);
    var sql = new StringBuilder(64 + count * 3)
        .append("SELECT ").append(ID).append(", ").append(X).append(", ").append(Y)
        .append(" FROM ").append(TABLE).append(" WHERE ").append(ID).append(" IN (?");
    for (int index = 1; index < count; ++index)
      sql.append(", ?");
    return sql.append(')').toString();
  }


  /**
   * Checks the table exists and has exactly the expected columns.
   *
   * @throws SqlStoreException if the schema doesn't match
   */
  public static void validate(Connection con) throws SqlStoreException {
    try (var stmt = con.createStatement();
         var rs = stmt.executeQuery("SELECT * FROM " + TABLE + " WHERE 1 = 0")) {

      ResultSetMetaData meta = rs.getMetaData();
      var actual = new ArrayList<String>(meta.getColumnCount());
      for (int col = 1; col <= meta.getColumnCount(); ++col)
        actual.add(meta.getColumnName(col).toLowerCase(Locale.ROOT));

      var missing = new ArrayList<>(COLUMNS);
      missing.removeAll(actual);
      var unknown = new ArrayList<>(actual);
      unknown.removeAll(COLUMNS);
      if (!missing.isEmpty() || !unknown.isEmpty())
        throw new SqlStoreException(
            "table '" + TABLE + "' has unexpected columns: missing " + missing +
            ", unknown " + unknown);

    } catch (SQLException sqx) {
      throw new SqlStoreException("no readable '" + TABLE + "' table: " + sqx.getMessage(), sqx);
    }
  }


  /**
   * Decodes the current row of a {@linkplain #selectByIds(int) select-by-ids}
   * result set.
   */
  static SeqRecord decodeRow(ResultSet rs) throws SQLException {
    long id = rs.getLong(ID_COL);
    byte[] x = rs.getBytes(X_COL);
    byte[] y = rs.getBytes(Y_COL);
    if (x == null)
      throw new SqlStoreException("null x in row " + id);
    return new SeqRecord(id, SeqCodec.decode(x), y == null ? null : SeqCodec.decode(y));
  }

}
