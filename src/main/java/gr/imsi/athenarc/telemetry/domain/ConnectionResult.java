package gr.imsi.athenarc.telemetry.domain;

import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a connectivity test. Instances are immutable.
 */
public final class ConnectionResult {

    private final boolean successful;
    private final String message;
    private final Throwable exception;
    private final Duration latency;
    private final ImmutableMap<String, String> metadata;

    private ConnectionResult(boolean successful, String message, Throwable exception, Duration latency,
                             Map<String, String> metadata) {
        this.successful = successful;
        this.message = message;
        this.exception = exception;
        this.latency = latency;
        this.metadata = metadata == null ? ImmutableMap.of() : ImmutableMap.copyOf(metadata);
    }

    public static ConnectionResult success(String message, Duration latency, Map<String, String> metadata) {
        return new ConnectionResult(true, message, null, latency, metadata);
    }

    public static ConnectionResult success(String message, Duration latency) {
        return success(message, latency, null);
    }

    public static ConnectionResult failure(String message, Throwable exception) {
        return new ConnectionResult(false, message, exception, null, null);
    }

    public static ConnectionResult failure(String message, Throwable exception, Duration latency) {
        return new ConnectionResult(false, message, exception, latency, null);
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getMessage() {
        return message;
    }

    public Optional<Throwable> getException() {
        return Optional.ofNullable(exception);
    }

    public Optional<Duration> getLatency() {
        return Optional.ofNullable(latency);
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return (successful ? "OK" : "FAILED") + ": " + message
            + (latency != null ? " (" + latency.toMillis() + " ms)" : "");
    }
}
