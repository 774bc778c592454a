package gr.imsi.athenarc.telemetry.datasource.executor;

/**
 * Runs native queries against one backend.
 * @param <Q> native query type
 * @param <R> raw result type
 */
public interface QueryExecutor<Q, R> {

    R executeDbQuery(Q query);

    void closeConnection();
}
