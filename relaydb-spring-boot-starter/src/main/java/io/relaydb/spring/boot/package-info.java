/**
 * Spring Boot auto-configuration for relay schema migration.
 *
 * <p>{@link io.relaydb.spring.boot.RelayDbAutoConfiguration} upgrades the schema of the
 * application {@link javax.sql.DataSource} during startup, configured by {@code relaydb.*}
 * application properties.
 *
 * @see io.relaydb.spring.boot.RelayDbAutoConfiguration
 * @see io.relaydb.spring.boot.RelayDbProperties
 */
package io.relaydb.spring.boot;
