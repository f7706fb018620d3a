package com.vortex.runtime;

import com.vortex.exception.NotImplementedException;
import com.vortex.exception.QueryExecutionException;
import com.vortex.generator.QueryEnvironment;
import com.vortex.generator.SQLStatement;
import com.vortex.labels.LabelNames;
import com.vortex.labels.Labels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Log querier that translates requests through a {@link QueryEnvironment}
 * and runs them over JDBC.
 *
 * <p>Example usage:
 * <pre>
 *   QuerierConfig config = QuerierConfig.fromSystemProperties();
 *   LogQuerier querier = new JdbcLogQuerier(dataSource::getConnection, config.createEnvironment());
 *
 *   try (EntryIterator it = querier.selectLogs(new SelectLogParams(
 *           MatchersExpr.of(Matcher.equal("service_name", "api")),
 *           start, end, 100, Direction.BACKWARD))) {
 *       while (it.next()) {
 *           System.out.println(it.labels() + " " + it.entry().line());
 *       }
 *   }
 * </pre>
 *
 * <p>Label and series queries are read eagerly and release their connection
 * before returning. Log line queries stream: the connection stays open until
 * the returned iterator is closed.
 */
public class JdbcLogQuerier implements LogQuerier {

    private static final Logger logger = LoggerFactory.getLogger(JdbcLogQuerier.class);

    private final ConnectionSource connections;
    private final QueryEnvironment environment;

    /**
     * Creates a querier.
     *
     * @param connections the connection source
     * @param environment the translator for the target table and dialect
     */
    public JdbcLogQuerier(ConnectionSource connections, QueryEnvironment environment) {
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    @Override
    public EntryIterator selectLogs(SelectLogParams params) {
        Objects.requireNonNull(params, "params must not be null");
        SQLStatement statement = environment.selectLogsQuery(
            params.selector(), params.start(), params.end(), params.limit(), params.direction());

        Connection conn = null;
        PreparedStatement ps = null;
        ResultSet rs = null;
        try {
            conn = connections.getConnection();
            ps = conn.prepareStatement(statement.sql());
            statement.bind(ps);
            rs = ps.executeQuery();
            logger.debug("Streaming log rows for {}", params.selector());
            return new RowEntryIterator(new JdbcRowCursor(rs, ps, conn));
        } catch (SQLException e) {
            logger.error("Log query failed: {}", statement.sql(), e);
            closeQuietly(rs, "ResultSet");
            closeQuietly(ps, "PreparedStatement");
            closeQuietly(conn, "Connection");
            throw new QueryExecutionException("Failed to execute log query: " + e.getMessage(), e, statement.sql());
        }
    }

    @Override
    public List<String> label(LabelRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        SQLStatement statement = environment.labelQuery(
            request.name(), request.values(), request.start(), request.end());

        List<String> result = new ArrayList<>();
        try (Connection conn = connections.getConnection();
             PreparedStatement ps = conn.prepareStatement(statement.sql())) {
            statement.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String value = rs.getString(1);
                    if (value != null) {
                        result.add(LabelNames.normalize(value));
                    }
                }
            }
        } catch (SQLException e) {
            logger.error("Label query failed: {}", statement.sql(), e);
            throw new QueryExecutionException("Failed to execute label query: " + e.getMessage(), e, statement.sql());
        }

        logger.debug("Label query returned {} values", result.size());
        return result;
    }

    @Override
    public List<Labels> series(SeriesRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        SQLStatement statement = environment.seriesQuery(request.groups(), request.start(), request.end());

        List<Labels> result = new ArrayList<>();
        try (Connection conn = connections.getConnection();
             PreparedStatement ps = conn.prepareStatement(statement.sql())) {
            statement.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Map<String, String> normalized = new TreeMap<>();
                    new TreeMap<>(JdbcValues.toStringMap(rs.getObject(1))).forEach((key, value) ->
                        normalized.put(LabelNames.normalize(key), value));
                    result.add(Labels.fromMap(normalized));
                }
            }
        } catch (SQLException e) {
            logger.error("Series query failed: {}", statement.sql(), e);
            throw new QueryExecutionException("Failed to execute series query: " + e.getMessage(), e, statement.sql());
        }

        logger.debug("Series query returned {} label sets", result.size());
        return result;
    }

    @Override
    public List<Sample> selectSamples(SelectSampleParams params) {
        throw new NotImplementedException("SelectSamples");
    }

    @Override
    public EntryIterator tail(SelectLogParams params) {
        throw new NotImplementedException("Tail");
    }

    @Override
    public IndexStats indexStats(SeriesRequest request) {
        throw new NotImplementedException("IndexStats");
    }

    @Override
    public Map<Labels, Long> seriesVolume(SeriesRequest request) {
        throw new NotImplementedException("SeriesVolume");
    }

    private static void closeQuietly(AutoCloseable resource, String name) {
        if (resource != null) {
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
