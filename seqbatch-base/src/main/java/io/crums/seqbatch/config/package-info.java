/*
 * Copyright 2025 Babak Farhang
 */
/**
 * File-based dataset configuration.
 */
package io.crums.seqbatch.config;
