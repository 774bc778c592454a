package gr.imsi.athenarc.telemetry.datasource.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.telemetry.datasource.DataSourceException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON over HTTP connection to the query API.
 */
public class ApiConnection implements DatabaseConnection {
    private static final Logger LOG = LoggerFactory.getLogger(ApiConnection.class);

    private final String baseUrl;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper;
    private CloseableHttpClient httpClient;

    public ApiConnection(String baseUrl, int timeoutSeconds) {
        this(baseUrl, timeoutSeconds, null);
    }

    /**
     * Uses the given client instead of building one on {@link #connect()}.
     */
    public ApiConnection(String baseUrl, int timeoutSeconds, CloseableHttpClient httpClient) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL is required");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeoutSeconds = timeoutSeconds;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public DatabaseConnection connect() {
        if (httpClient == null) {
            int timeoutMillis = timeoutSeconds * 1000;
            RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();
            httpClient = HttpClients.custom().setDefaultRequestConfig(requestConfig).build();
            LOG.info("Initialized API client with base URL: {}", baseUrl);
        }
        return this;
    }

    @Override
    public boolean isConnected() {
        return httpClient != null;
    }

    @Override
    public void closeConnection() {
        if (httpClient == null) {
            return;
        }
        try {
            httpClient.close();
        } catch (IOException e) {
            throw new DataSourceException("Error closing HTTP client", e);
        } finally {
            httpClient = null;
        }
    }

    /**
     * Issues a GET and returns the response body.
     * @throws DataSourceException on I/O errors or a non-2xx status
     */
    public String get(String path) {
        HttpGet get = new HttpGet(baseUrl + path);
        get.addHeader("Accept", "application/json");
        return execute(get);
    }

    public <T> T get(String path, Class<T> responseType) {
        return readJson(get(path), responseType);
    }

    /**
     * Posts the body serialized as JSON and maps the JSON response onto {@code responseType}.
     * @throws DataSourceException on I/O errors, a non-2xx status or an unreadable response
     */
    public <T> T post(String path, Object body, Class<T> responseType) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DataSourceException("Could not serialize request: " + e.getMessage(), e);
        }
        LOG.debug("Sending request to {}{}: {}", baseUrl, path, json);
        HttpPost post = new HttpPost(baseUrl + path);
        post.addHeader("Accept", "application/json");
        post.setEntity(new StringEntity(json, ContentType.APPLICATION_JSON));
        return readJson(execute(post), responseType);
    }

    private String execute(HttpUriRequest request) {
        connect();
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            String body = response.getEntity() != null
                ? EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8) : "";
            if (status < 200 || status >= 300) {
                throw new DataSourceException(String.format("%s %s failed with status %d: %s",
                    request.getMethod(), request.getURI(), status, body));
            }
            return body;
        } catch (IOException e) {
            throw new DataSourceException(String.format("%s %s failed: %s",
                request.getMethod(), request.getURI(), e.getMessage()), e);
        }
    }

    private <T> T readJson(String json, Class<T> responseType) {
        try {
            return objectMapper.readValue(json, responseType);
        } catch (JsonProcessingException e) {
            throw new DataSourceException("Could not parse API response: " + e.getMessage(), e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

}
