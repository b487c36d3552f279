/**
 * Built-in {@link io.relaydb.spi.ProgressListener} implementations.
 */
package io.relaydb.progress;
