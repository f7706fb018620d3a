package com.vortex.generator;

import com.vortex.labels.LabelNames;
import com.vortex.logql.Direction;
import com.vortex.logql.LogSelectorExpr;
import com.vortex.logql.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Query environment for the OpenTelemetry logs table layout:
 * <pre>
 *   Timestamp            high-resolution timestamp
 *   Body                 log line
 *   ResourceAttributes   map of attribute key to value
 * </pre>
 *
 * <p>Generated statements, in ClickHouse rendering:
 * <pre>
 *   -- {service_name="api"} |= "error", FORWARD, limit 100
 *   SELECT `Timestamp`, `Body`, `ResourceAttributes` FROM `otel`.`logs`
 *   WHERE `Timestamp` &gt;= fromUnixTimestamp64Nano(?) AND `Timestamp` &lt;= fromUnixTimestamp64Nano(?)
 *     AND arrayElement(`ResourceAttributes`, ?) = ? AND `Body` LIKE ?
 *   ORDER BY `Timestamp` ASC LIMIT 100
 *
 *   -- values of label "env"
 *   SELECT DISTINCT arrayElement(`ResourceAttributes`, ?) FROM `otel`.`logs`
 *
 *   -- label names
 *   SELECT DISTINCT arrayJoin(mapKeys(`ResourceAttributes`)) FROM `otel`.`logs`
 * </pre>
 *
 * <p>Series queries AND every matcher of every group together, so several
 * groups narrow the result rather than widen it.
 */
public final class OtelQueryEnvironment implements QueryEnvironment {

    private static final Logger logger = LoggerFactory.getLogger(OtelQueryEnvironment.class);

    public static final String LABELS_COLUMN = "ResourceAttributes";
    public static final String TIMESTAMP_COLUMN = "Timestamp";
    public static final String BODY_COLUMN = "Body";

    private final SQLDialect dialect;
    private final String tableName;
    private final String timestampColumn;
    private final String bodyColumn;
    private final String labelsColumn;

    /**
     * Creates an environment for one logs table.
     *
     * @param dialect the target dialect
     * @param database the database (or schema) holding the table
     * @param table the logs table
     */
    public OtelQueryEnvironment(SQLDialect dialect, String database, String table) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.tableName = dialect.qualifiedTable(
            Objects.requireNonNull(database, "database must not be null"),
            Objects.requireNonNull(table, "table must not be null"));
        this.timestampColumn = dialect.quoteIdentifier(TIMESTAMP_COLUMN);
        this.bodyColumn = dialect.quoteIdentifier(BODY_COLUMN);
        this.labelsColumn = dialect.quoteIdentifier(LABELS_COLUMN);
    }

    public SQLDialect dialect() {
        return dialect;
    }

    /**
     * Returns the quoted, database-qualified table reference.
     *
     * @return the table reference
     */
    public String tableName() {
        return tableName;
    }

    @Override
    public SQLStatement selectLogsQuery(LogSelectorExpr selector, Instant start, Instant end,
                                        int limit, Direction direction) {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");

        SelectBuilder sb = new SelectBuilder()
            .select(timestampColumn, bodyColumn, labelsColumn)
            .from(tableName)
            .where(since(start))
            .where(until(end))
            .limit(limit);

        String orderBy = timestampColumn;
        if (direction == Direction.BACKWARD) {
            orderBy += " DESC";
        } else if (direction == Direction.FORWARD) {
            orderBy += " ASC";
        }
        sb.orderBy(orderBy);

        new LogQLTransformer(sb, dialect, labelsColumn, bodyColumn).acceptLogSelector(selector);

        SQLStatement statement = sb.build();
        if (logger.isDebugEnabled()) {
            logger.debug("selectLogsQuery {} [{}, {}] -> {}", selector, start, end, statement);
        }
        return statement;
    }

    @Override
    public SQLStatement labelQuery(String name, boolean values, Instant start, Instant end) {
        SelectBuilder sb = new SelectBuilder()
            .from(tableName)
            .distinct();

        if (values) {
            Objects.requireNonNull(name, "name must not be null when listing values");
            sb.select(dialect.mapElement(labelsColumn, LabelNames.denormalize(name)));
        } else {
            sb.select(dialect.mapKeys(labelsColumn));
        }
        if (start != null) {
            sb.where(since(start));
        }
        if (end != null) {
            sb.where(until(end));
        }

        SQLStatement statement = sb.build();
        if (logger.isDebugEnabled()) {
            logger.debug("labelQuery name={} values={} -> {}", name, values, statement);
        }
        return statement;
    }

    @Override
    public SQLStatement seriesQuery(List<List<Matcher>> groups, Instant start, Instant end) {
        Objects.requireNonNull(groups, "groups must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");

        SelectBuilder sb = new SelectBuilder()
            .select(labelsColumn)
            .from(tableName)
            .distinct()
            .where(since(start))
            .where(until(end));

        LogQLTransformer transformer = new LogQLTransformer(sb, dialect, labelsColumn, bodyColumn);
        for (List<Matcher> group : groups) {
            for (Matcher matcher : group) {
                transformer.acceptMatcher(matcher, null);
            }
        }

        SQLStatement statement = sb.build();
        if (logger.isDebugEnabled()) {
            logger.debug("seriesQuery {} groups -> {}", groups.size(), statement);
        }
        return statement;
    }

    private SQLFragment since(Instant start) {
        return SQLFragment.of(timestampColumn + " >= ").append(dialect.timestamp(start));
    }

    private SQLFragment until(Instant end) {
        return SQLFragment.of(timestampColumn + " <= ").append(dialect.timestamp(end));
    }
}
