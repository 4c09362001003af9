package com.example.datalake.fieldcheck.dao;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.SqlParameterValue;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * {@link RecordStore} backed by a {@link JdbcTemplate}. Table and column names are checked
 * against a plain identifier pattern before they reach SQL; values are always bound as
 * parameters.
 */
@Slf4j
public class JdbcRecordStore implements RecordStore {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final String idColumn;
    private final Map<String, String> displayFormats;
    private final ConcurrentMap<String, JdbcRecordTable> tables = new ConcurrentHashMap<>();

    public JdbcRecordStore(JdbcTemplate jdbcTemplate, String idColumn, Map<String, String> displayFormats) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.idColumn = requireIdentifier(idColumn);
        Map<String, String> formats = new ConcurrentHashMap<>();
        if (displayFormats != null) {
            displayFormats.forEach((table, format) -> {
                if (table != null && format != null && !format.isBlank()) {
                    formats.put(table.toLowerCase(Locale.ROOT), format);
                }
            });
        }
        this.displayFormats = Collections.unmodifiableMap(formats);
    }

    @Override
    public RecordTable table(String name) {
        String tableName = requireIdentifier(name);
        return tables.computeIfAbsent(tableName.toLowerCase(Locale.ROOT), key -> loadTable(tableName));
    }

    @Override
    public RecordQuery query(RecordTable table) {
        if (!(table instanceof JdbcRecordTable jdbcTable)) {
            throw new IllegalArgumentException("Table " + table + " does not belong to this store");
        }
        return new JdbcRecordQuery(jdbcTable, List.of());
    }

    private JdbcRecordTable loadTable(String name) {
        final String sql = "select * from " + name + " where 1 = 0";
        Map<String, Integer> columns;
        try {
            columns = jdbcTemplate.query(sql, (ResultSetExtractor<Map<String, Integer>>) rs -> {
                ResultSetMetaData meta = rs.getMetaData();
                Map<String, Integer> types = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    types.put(meta.getColumnLabel(i), meta.getColumnType(i));
                }
                return types;
            });
        } catch (BadSqlGrammarException e) {
            throw new UnknownTableException(name, e);
        }
        log.debug("[record-store] Loaded table {} with column types {}", name, columns);
        String format = displayFormats.get(name.toLowerCase(Locale.ROOT));
        return new JdbcRecordTable(name, columns == null ? Map.of() : columns, format);
    }

    private static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid SQL identifier: " + name);
        }
        return name;
    }

    private final class JdbcRecordTable implements RecordTable {

        private final String name;
        // column name to java.sql.Types code
        private final Map<String, Integer> columns;
        private final String displayFormat;

        private JdbcRecordTable(String name, Map<String, Integer> columns, String displayFormat) {
            this.name = name;
            this.columns = columns;
            this.displayFormat = displayFormat;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getIdColumn() {
            return idColumn;
        }

        @Override
        public RecordColumn column(String column) {
            requireIdentifier(column);
            if (!columns.containsKey(column)) {
                throw new UnknownColumnException(name, column);
            }
            return new RecordColumn(name, column);
        }

        @Override
        public Optional<String> getDisplayFormat() {
            return Optional.ofNullable(displayFormat);
        }

        private int sqlType(String column) {
            Integer type = columns.get(column);
            if (type == null) {
                throw new UnknownColumnException(name, column);
            }
            return type;
        }

        @Override
        public String toString() {
            return "JdbcRecordTable[" + name + "]";
        }
    }

    private final class JdbcRecordQuery implements RecordQuery {

        private final JdbcRecordTable table;
        private final List<Condition> conditions;

        private JdbcRecordQuery(JdbcRecordTable table, List<Condition> conditions) {
            this.table = table;
            this.conditions = conditions;
        }

        @Override
        public RecordQuery where(Condition condition) {
            Objects.requireNonNull(condition, "condition");
            if (!table.getName().equalsIgnoreCase(condition.column().table())) {
                throw new IllegalArgumentException(
                        "Column " + condition.column().name() + " does not belong to table " + table.getName());
            }
            List<Condition> next = new ArrayList<>(conditions);
            next.add(condition);
            return new JdbcRecordQuery(table, List.copyOf(next));
        }

        @Override
        public List<RecordRow> select(Ordering orderBy, Integer limit) {
            List<Object> args = new ArrayList<>();
            StringBuilder sql = new StringBuilder("select * from ").append(table.getName());
            appendWhere(sql, args);
            if (orderBy != null) {
                sql.append(" order by ")
                        .append(requireIdentifier(orderBy.column().name()))
                        .append(orderBy.ascending() ? " asc" : " desc");
            }
            if (limit != null) {
                if (limit < 0) {
                    throw new IllegalArgumentException("limit must not be negative");
                }
                sql.append(" limit ").append(limit);
            }
            log.debug("[record-store] {} {}", sql, conditions);
            return jdbcTemplate.queryForList(sql.toString(), args.toArray()).stream()
                    .map(row -> new RecordRow(row, idColumn))
                    .toList();
        }

        @Override
        public long count() {
            List<Object> args = new ArrayList<>();
            StringBuilder sql = new StringBuilder("select count(*) from ").append(table.getName());
            appendWhere(sql, args);
            log.debug("[record-store] {} {}", sql, conditions);
            Long count = jdbcTemplate.queryForObject(sql.toString(), Long.class, args.toArray());
            return count == null ? 0L : count;
        }

        private void appendWhere(StringBuilder sql, List<Object> args) {
            if (conditions.isEmpty()) {
                return;
            }
            sql.append(" where ");
            for (int i = 0; i < conditions.size(); i++) {
                Condition condition = conditions.get(i);
                if (i > 0) {
                    sql.append(" and ");
                }
                sql.append(requireIdentifier(condition.column().name()));
                if (condition.value() == null) {
                    sql.append(" is null");
                } else {
                    sql.append(" = ?");
                    // form input is usually a string; let the driver convert it to the column type
                    args.add(new SqlParameterValue(table.sqlType(condition.column().name()), condition.value()));
                }
            }
        }
    }
}
