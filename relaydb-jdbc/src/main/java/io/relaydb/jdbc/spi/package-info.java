/**
 * Extension points of the JDBC module.
 */
package io.relaydb.jdbc.spi;
