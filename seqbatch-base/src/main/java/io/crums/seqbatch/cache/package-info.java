/*
 * Copyright 2025 Babak Farhang
 */
/**
 * In-memory copies of record stores, with on-disk snapshots keyed by the
 * source path. Stores are not supposed to change once written, so a snapshot
 * is not checked against its source's contents.
 */
package io.crums.seqbatch.cache;
