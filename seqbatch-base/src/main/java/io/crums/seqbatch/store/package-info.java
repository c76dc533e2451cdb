/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Record stores: the flat-file store, and the seam for indexed stores that
 * support a length projection and access by id.
 */
package io.crums.seqbatch.store;
