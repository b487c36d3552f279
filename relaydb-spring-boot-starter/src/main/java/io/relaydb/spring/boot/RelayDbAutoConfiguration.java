package io.relaydb.spring.boot;

import io.relaydb.jdbc.DataSourceConnectionProvider;
import io.relaydb.jdbc.dialect.Dialects;
import io.relaydb.jdbc.migration.MigrationRunner;
import io.relaydb.jdbc.spi.Dialect;
import io.relaydb.progress.LoggingProgressListener;
import io.relaydb.spi.ConnectionProvider;
import io.relaydb.spi.MetricsExporter;
import io.relaydb.spi.ProgressListener;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for relay schema migration.
 *
 * <p>Detects the {@link Dialect} from the {@link DataSource}, builds a
 * {@link MigrationRunner} from {@link RelayDbProperties} and, unless
 * {@code relaydb.migration.enabled=false}, upgrades the schema during startup.
 *
 * @see RelayDbProperties
 * @see RelayDbMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MigrationRunner.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RelayDbProperties.class)
public class RelayDbAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Dialect relayDbDialect(DataSource dataSource) {
        return Dialects.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ProgressListener.class)
    public LoggingProgressListener progressListener(RelayDbProperties props) {
        return new LoggingProgressListener(props.getMigration().getProgressLogInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationRunner migrationRunner(RelayDbProperties props,
                                           ConnectionProvider connectionProvider,
                                           Dialect dialect,
                                           ProgressListener progressListener,
                                           ObjectProvider<MetricsExporter> metricsProvider) {
        var builder = MigrationRunner.builder()
                .connectionProvider(connectionProvider)
                .dialect(dialect)
                .progressListener(progressListener)
                .backfillFetchSize(props.getMigration().getBackfillFetchSize());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "relaydb.migration", name = "enabled", matchIfMissing = true)
    public SchemaMigrationInitializer schemaMigrationInitializer(MigrationRunner migrationRunner,
                                                                 RelayDbProperties props) {
        return new SchemaMigrationInitializer(migrationRunner, props.getMigration().isRebuildTags());
    }
}
