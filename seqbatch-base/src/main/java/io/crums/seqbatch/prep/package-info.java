/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Parallel preprocessing of raw text corpora into integer sequences.
 */
package io.crums.seqbatch.prep;
