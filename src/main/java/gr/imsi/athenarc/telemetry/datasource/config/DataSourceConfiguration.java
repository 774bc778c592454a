package gr.imsi.athenarc.telemetry.datasource.config;

import gr.imsi.athenarc.telemetry.domain.DatabaseType;

/**
 * Resolved, plain-text configuration a data source is built from.
 */
public interface DataSourceConfiguration {

    DatabaseType getDatabaseType();

    boolean isValid();
}
