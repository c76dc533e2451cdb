/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Batch iteration under a token budget.
 * 
 * <h2>Budget</h2>
 * <p>
 * A bucket of {@code n} records whose longest side is {@code m} tokens costs
 * {@code n * m}, the size of its padded matrix. Records are admitted to a bucket
 * so long as that cost stays within the budget. A record that alone exceeds the
 * budget is an error.
 * </p>
 */
package io.crums.seqbatch.iter;
