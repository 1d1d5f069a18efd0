package com.tessera.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Ships engine log records to a central JDBC table in batches from a background thread.
 * Construction fails with {@link IllegalStateException} when no JDBC URL is configured.
 */
public final class DatabaseLogHandler extends Handler {

    private static final String INSERT_SQL = """
        INSERT INTO mosaic_logs (
            logged_at,
            level,
            logger,
            message,
            details,
            thread_name,
            host,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    private static final int QUEUE_CAPACITY = 2048;
    private static final int MAX_BATCH = 64;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final HikariDataSource dataSource;
    private final String hostName;
    private final Thread worker;

    private volatile boolean running = true;

    public DatabaseLogHandler() {
        DbConfig config = DbConfig.load();
        if (!config.enabled()) {
            throw new IllegalStateException("no JDBC URL configured");
        }
        this.dataSource = createDataSource(config);
        this.hostName = resolveHostName();
        this.worker = new Thread(this::drainLoop, "mosaic-log-writer");
        this.worker.setDaemon(true);
        this.worker.start();
        setLevel(Level.ALL);
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!running || !isLoggable(record)) {
            return;
        }
        // drop the oldest record rather than block the engine
        while (!queue.offer(record)) {
            queue.poll();
        }
    }

    @Override
    public void flush() {
        // records are written by the worker thread
    }

    @Override
    public void close() throws SecurityException {
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void drainLoop() {
        List<LogRecord> batch = new ArrayList<>(MAX_BATCH);
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                LogRecord first = queue.poll(1, TimeUnit.SECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, MAX_BATCH - 1);
                writeBatch(batch);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            } catch (SQLException ex) {
                reportFailure("batch write failed", ex);
            } finally {
                batch.clear();
            }
        }

        // clear the shutdown interrupt so the final flush can still borrow a connection
        Thread.interrupted();
        queue.drainTo(batch);
        if (!batch.isEmpty()) {
            try {
                writeBatch(batch);
            } catch (SQLException ex) {
                reportFailure("shutdown flush failed", ex);
            }
        }
    }

    private void writeBatch(List<LogRecord> records) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : records) {
                bind(statement, record);
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private void bind(PreparedStatement statement, LogRecord record) throws SQLException {
        statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
        statement.setString(2, record.getLevel().getName());
        statement.setString(3, record.getLoggerName());
        statement.setString(4, renderMessage(record));
        statement.setString(5, formatParameters(record));
        statement.setString(6, "thread-" + record.getLongThreadID());
        statement.setString(7, hostName);
        Throwable thrown = record.getThrown();
        statement.setString(8, thrown == null ? null : thrown.getClass().getName());
        statement.setString(9, thrown == null ? null : thrown.getMessage());
    }

    private static void reportFailure(String what, Exception ex) {
        // the JUL pipeline is what failed, so fall back to stderr
        System.err.println("DatabaseLogHandler " + what + ": " + ex.getMessage());
    }

    private static String formatParameters(LogRecord record) {
        Object[] params = record.getParameters();
        if (params == null || params.length == 0) {
            return null;
        }
        return Arrays.toString(params);
    }

    private static String renderMessage(LogRecord record) {
        String message = record.getMessage();
        if (message == null) {
            return "";
        }
        Object[] params = record.getParameters();
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource createDataSource(DbConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.url());
        hikariConfig.setUsername(config.username());
        hikariConfig.setPassword(config.password());
        hikariConfig.setMaximumPoolSize(config.poolSize());
        hikariConfig.setPoolName("MosaicLoggingPool");
        hikariConfig.setAutoCommit(true);
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }

    private record DbConfig(String url, String username, String password, int poolSize) {

        private static final String RESOURCE = "logging-db.properties";

        boolean enabled() {
            return url != null && !url.isBlank();
        }

        static DbConfig load() {
            Properties fileProps = loadFileProperties();
            return new DbConfig(
                firstNonBlank(System.getProperty("logging.jdbc.url"),
                    System.getenv("LOGGING_JDBC_URL"),
                    fileProps.getProperty("jdbc.url")),
                firstNonBlank(System.getProperty("logging.jdbc.user"),
                    System.getenv("LOGGING_JDBC_USER"),
                    fileProps.getProperty("jdbc.username")),
                firstNonBlank(System.getProperty("logging.jdbc.pass"),
                    System.getenv("LOGGING_JDBC_PASS"),
                    fileProps.getProperty("jdbc.password")),
                parsePoolSize(firstNonBlank(System.getProperty("logging.jdbc.poolSize"),
                    System.getenv("LOGGING_JDBC_POOL"),
                    fileProps.getProperty("jdbc.poolSize")))
            );
        }

        private static Properties loadFileProperties() {
            Properties props = new Properties();
            try (InputStream stream = DatabaseLogHandler.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ex) {
                System.err.println("Ignoring unreadable " + RESOURCE + ": " + ex.getMessage());
            }
            return props;
        }

        private static String firstNonBlank(String... values) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            return null;
        }

        private static int parsePoolSize(String raw) {
            try {
                return raw == null ? 2 : Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return 2;
            }
        }
    }
}
