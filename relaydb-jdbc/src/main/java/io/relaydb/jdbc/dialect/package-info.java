/**
 * Built-in {@link io.relaydb.jdbc.spi.Dialect} implementations and the
 * {@link io.relaydb.jdbc.dialect.Dialects} lookup.
 */
package io.relaydb.jdbc.dialect;
