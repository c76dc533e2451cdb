/*
 * Copyright 2025 Babak Farhang
 */
/**
 * H2-backed indexed record store, and loading of training data per
 * configuration.
 * 
 * <h2>Notes</h2>
 * <p>
 * The database holds a single table. Length ordering is done in memory over
 * the {@code (id, x_len, y_len)} projection, so that it follows the configured
 * random seed; the records themselves are then fetched by id.
 * </p>
 */
package io.crums.seqbatch.sql;
