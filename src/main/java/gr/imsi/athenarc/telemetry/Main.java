package gr.imsi.athenarc.telemetry;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.aggregation.AggregationStrategy;
import gr.imsi.athenarc.telemetry.aggregation.AggregationStrategyFactory;
import gr.imsi.athenarc.telemetry.datasource.DataSource;
import gr.imsi.athenarc.telemetry.datasource.DataSourceFactory;
import gr.imsi.athenarc.telemetry.datasource.SupportsHierarchyDiscovery;
import gr.imsi.athenarc.telemetry.datasource.config.DatabaseConfig;
import gr.imsi.athenarc.telemetry.domain.AggregationConfiguration;
import gr.imsi.athenarc.telemetry.domain.AggregationKind;
import gr.imsi.athenarc.telemetry.domain.ConnectionResult;
import gr.imsi.athenarc.telemetry.domain.DataPoint;
import gr.imsi.athenarc.telemetry.domain.DatabaseType;
import gr.imsi.athenarc.telemetry.domain.HierarchyLevel;
import gr.imsi.athenarc.telemetry.domain.QueryParams;
import gr.imsi.athenarc.telemetry.domain.TimeWindow;
import gr.imsi.athenarc.telemetry.security.NoOpCredentialEncryptor;
import gr.imsi.athenarc.telemetry.util.DataPointCsvWriter;
import gr.imsi.athenarc.telemetry.util.InstantConverter;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point: runs one query, aggregation, connection test or ID discovery against
 * the configured backend and prints the result as CSV.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Parameter(names = "--type", description = "Backend type (INFLUXDB, POSTGRESQL, HISTORIAN_API, AGGREGATES_API). Defaults to datasource.type")
    String type;

    @Parameter(names = "--config", description = "Path of a properties file to use instead of the bundled application.properties")
    String config;

    @Parameter(names = "--start", converter = InstantConverter.class, description = "Start of the time range (inclusive)")
    Instant start;

    @Parameter(names = "--end", converter = InstantConverter.class, description = "End of the time range")
    Instant end;

    @Parameter(names = "--collector", description = "Comma-separated collector IDs")
    String collector;

    @Parameter(names = "--gateway", description = "Comma-separated gateway IDs")
    String gateway;

    @Parameter(names = "--equipment", description = "Comma-separated equipment IDs")
    String equipment;

    @Parameter(names = "--tag", description = "Comma-separated tag IDs")
    String tag;

    @Parameter(names = "--limit", description = "Maximum number of rows")
    Integer limit;

    @Parameter(names = "--aggregations", description = "Aggregation kinds (average, total, min_max, first_last, delta)")
    List<String> aggregations = new ArrayList<>();

    @Parameter(names = "--windows", description = "Time windows (5m, 15m, 30m, 60m), 60m if omitted")
    List<String> windows = new ArrayList<>();

    @Parameter(names = "--discover", description = "List the IDs of a hierarchy level (COLLECTOR, GATEWAY, EQUIPMENT, TAG)")
    String discover;

    @Parameter(names = "--test", description = "Only test the connection")
    boolean test;

    @Parameter(names = "--help", help = true, description = "Displays help")
    boolean help;

    public static void main(String... args) throws IOException {
        Main main = new Main();
        JCommander jCommander = JCommander.newBuilder()
            .addObject(main)
            .programName("telemetry-query")
            .build();
        jCommander.parse(args);
        if (main.help) {
            jCommander.usage();
            return;
        }
        Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        main.run(out);
        out.flush();
    }

    void run(Writer out) {
        Properties properties = config != null ? ConfigLoader.readPropertiesFromFile(config) : ConfigLoader.readProperties();
        Preconditions.checkNotNull(properties, "No configuration could be loaded.");
        DatabaseType databaseType = resolveType(properties);
        DatabaseConfig databaseConfig = ConfigLoader.toDatabaseConfig(databaseType, properties);

        DataSourceFactory factory = new DataSourceFactory(new NoOpCredentialEncryptor());
        try (DataSource dataSource = factory.createDataSource(databaseConfig)) {
            if (test) {
                ConnectionResult result = dataSource.testConnection();
                new PrintWriter(out, true).println(result);
                return;
            }
            if (discover != null) {
                printIds(dataSource, out);
                return;
            }
            Stopwatch stopwatch = Stopwatch.createStarted();
            QueryParams params = buildQueryParams();
            List<DataPoint> dataPoints;
            if (!aggregations.isEmpty()) {
                AggregationStrategy strategy = AggregationStrategyFactory.createStrategy(databaseType, dataSource);
                LOG.info("Using aggregation strategy: {}", strategy.getDescription());
                dataPoints = strategy.applyAggregation(params, buildAggregationConfiguration(databaseType));
            } else {
                dataPoints = dataSource.queryData(params);
            }
            LOG.info("Fetched {} data points in {} ms", dataPoints.size(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
            DataPointCsvWriter.write(dataPoints, out);
        }
    }

    DatabaseType resolveType(Properties properties) {
        if (type != null) {
            return DatabaseType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        }
        return ConfigLoader.readDatabaseType(properties, DatabaseType.INFLUXDB);
    }

    QueryParams buildQueryParams() {
        QueryParams.Builder builder = QueryParams.builder()
            .collectorId(collector)
            .gatewayId(gateway)
            .equipmentId(equipment)
            .tagId(tag);
        if (end != null) {
            // keep the default one day range when only the end is given
            builder.endTime(end).startTime(end.minus(Duration.ofDays(1)));
        }
        if (start != null) {
            builder.startTime(start);
        }
        if (limit != null) {
            builder.limit(limit);
        }
        return builder.build();
    }

    AggregationConfiguration buildAggregationConfiguration(DatabaseType databaseType) {
        List<AggregationKind> kinds = new ArrayList<>();
        for (String token : aggregations) {
            kinds.add(AggregationKind.fromToken(token.trim()));
        }
        List<TimeWindow> timeWindows = new ArrayList<>();
        for (String period : windows) {
            timeWindows.add(TimeWindow.fromPeriod(period.trim()));
        }
        if (timeWindows.isEmpty()) {
            timeWindows.add(TimeWindow.SIXTY_MINUTES);
        }
        return new AggregationConfiguration(kinds, timeWindows, databaseType);
    }

    private void printIds(DataSource dataSource, Writer out) {
        HierarchyLevel level = HierarchyLevel.valueOf(discover.trim().toUpperCase(Locale.ROOT));
        Map<HierarchyLevel, String> parents = new EnumMap<>(HierarchyLevel.class);
        parents.put(HierarchyLevel.COLLECTOR, collector);
        parents.put(HierarchyLevel.GATEWAY, gateway);
        parents.put(HierarchyLevel.EQUIPMENT, equipment);
        parents.remove(level);
        List<String> ids = dataSource.capability(SupportsHierarchyDiscovery.class)
            .map(discovery -> discovery.getAvailableIds(level, parents))
            .orElseGet(() -> {
                LOG.warn("{} does not support ID discovery", dataSource.getDatabaseType().getDisplayName());
                return Collections.emptyList();
            });
        PrintWriter writer = new PrintWriter(out, true);
        ids.forEach(writer::println);
    }
}
