/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Padded batch matrices, BOS / EOS alignment, and attention masks.
 */
package io.crums.seqbatch.batch;
