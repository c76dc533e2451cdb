/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Token-budget batching of integer-sequence records for sequence-to-sequence
 * training. Records are {@linkplain io.crums.seqbatch.SeqRecord SeqRecord}s:
 * a source sequence, an optional target sequence, and a store-assigned id.
 * 
 * <h2>Packages</h2>
 * <p>
 * Records are read from a {@linkplain io.crums.seqbatch.store store}, optionally
 * {@linkplain io.crums.seqbatch.cache cached} in memory, grouped into buckets
 * under a token budget by the {@linkplain io.crums.seqbatch.iter iterables}, and
 * padded into {@linkplain io.crums.seqbatch.batch batches}. Raw corpora are
 * turned into records by the {@linkplain io.crums.seqbatch.prep preprocessor}.
 * </p><p>
 * Errors are unchecked, rooted at {@linkplain io.crums.seqbatch.SeqBatchException}.
 * </p>
 */
package io.crums.seqbatch;
