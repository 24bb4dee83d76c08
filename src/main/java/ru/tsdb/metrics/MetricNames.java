package ru.tsdb.metrics;

/**
 * Names of the metrics recorded by the service.
 */
public final class MetricNames {

    // Ingestion
    public static final String INGESTED_POINTS = "tsdb_ingestion_points_total";
    public static final String INGESTED_BATCHES = "tsdb_ingestion_batches_total";
    public static final String INGESTION_LATENCY = "tsdb_ingestion_latency_seconds";
    public static final String POINTS_WRITTEN = "tsdb_data_points_written_total";
    public static final String WRITE_ERRORS = "tsdb_write_errors_total";

    // Storage
    public static final String STORAGE_ROWS_WRITTEN = "tsdb_storage_rows_written_total";
    public static final String STORAGE_ROTATIONS = "tsdb_storage_rotations_total";
    public static final String STORAGE_CONNECTION_STATUS = "tsdb_storage_connection_status";

    // HTTP, labels: method, path, status_code / method, path
    public static final String HTTP_REQUESTS = "tsdb_http_requests_total";
    public static final String HTTP_REQUEST_DURATION = "tsdb_http_request_duration_seconds";
    public static final String HTTP_REQUESTS_IN_FLIGHT = "tsdb_http_requests_in_flight";

    // Server
    public static final String SERVER_STATUS = "tsdb_server_status";
    public static final String SERVER_HEALTH = "tsdb_server_health";
    public static final String SERVER_START_TIME = "tsdb_server_start_time_seconds";
    public static final String SERVER_UPTIME = "tsdb_server_uptime_seconds";
    public static final String SERVER_ACTIVE_CONNECTIONS = "tsdb_server_active_connections";
    public static final String SERVER_SHUTDOWN_DURATION = "tsdb_server_shutdown_duration_seconds";
    /** Labels: error_type, component. */
    public static final String SERVER_ERRORS = "tsdb_server_errors_total";
    public static final String SERVER_MEMORY_USAGE = "tsdb_server_memory_usage_bytes";
    public static final String SERVER_THREADS = "tsdb_server_threads";
    public static final String SERVER_CONFIG_PORT = "tsdb_server_config_port";
    public static final String SERVER_CONFIG_READ_TIMEOUT = "tsdb_server_config_read_timeout_seconds";
    public static final String SERVER_CONFIG_WRITE_TIMEOUT = "tsdb_server_config_write_timeout_seconds";
    public static final String SERVER_CONFIG_IDLE_TIMEOUT = "tsdb_server_config_idle_timeout_seconds";

    private MetricNames() {
        // Not instantiable
    }
}
