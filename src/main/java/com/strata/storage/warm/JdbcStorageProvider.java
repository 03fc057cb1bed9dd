package com.strata.storage.warm;

import com.strata.domain.ExecutionContext;
import com.strata.domain.QueryCriteria;
import com.strata.domain.QuerySpec;
import com.strata.domain.TechnologyType;
import com.strata.storage.StorageException;
import com.strata.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.transaction.support.TransactionOperations;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Storage provider for relational and warehouse stores reachable over JDBC
 * (CockroachDB/PostgreSQL for the warm tier, a SQL warehouse for the cold tier).
 *
 * Records map one-to-one onto table columns. Batches are written inside a
 * single transaction so a failed batch leaves no partial rows behind.
 * Each query stream holds its own read-only connection with autocommit off
 * until the stream is closed, so the driver reads rows in fetch-size chunks.
 */
public class JdbcStorageProvider implements StorageProvider {
    
    private static final Logger logger = LoggerFactory.getLogger(JdbcStorageProvider.class);
    
    private final String name;
    private final TechnologyType technologyType;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionOperations transactionOperations;
    private final SqlCriteriaTranslator translator = new SqlCriteriaTranslator();
    
    public JdbcStorageProvider(String name, TechnologyType technologyType, JdbcTemplate jdbcTemplate,
                               TransactionOperations transactionOperations) {
        this.name = name;
        this.technologyType = technologyType;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionOperations = transactionOperations;
    }
    
    @Override
    public String getName() {
        return name;
    }
    
    @Override
    public TechnologyType getTechnologyType() {
        return technologyType;
    }
    
    @Override
    public void insert(String tableName, Map<String, Object> record, ExecutionContext context) {
        List<String> columns = new ArrayList<>(record.keySet());
        String sql = insertSql(tableName, columns);
        Object[] args = columns.stream()
            .map(column -> SqlCriteriaTranslator.toSqlValue(record.get(column)))
            .toArray();
        try {
            jdbcTemplate.update(sql, args);
            logger.debug("Inserted record into {}.{} [{}]", name, tableName, context.getRequestId());
        } catch (DataAccessException e) {
            logger.error("Failed to insert record into {}.{}", name, tableName, e);
            throw new StorageException("Insert failed", name, tableName, e);
        }
    }
    
    @Override
    public void insertBatch(String tableName, List<Map<String, Object>> records, ExecutionContext context) {
        if (records.isEmpty()) {
            return;
        }
        
        // Union of all columns in first-seen order; absent values are bound as NULL
        Set<String> columnSet = new LinkedHashSet<>();
        records.forEach(record -> columnSet.addAll(record.keySet()));
        List<String> columns = new ArrayList<>(columnSet);
        
        String sql = insertSql(tableName, columns);
        List<Object[]> batchArgs = records.stream()
            .map(record -> columns.stream()
                .map(column -> SqlCriteriaTranslator.toSqlValue(record.get(column)))
                .toArray())
            .collect(Collectors.toList());
        
        try {
            transactionOperations.executeWithoutResult(status -> jdbcTemplate.batchUpdate(sql, batchArgs));
            logger.debug("Batch inserted {} records into {}.{} [{}]",
                records.size(), name, tableName, context.getRequestId());
        } catch (DataAccessException e) {
            logger.error("Failed to batch insert {} records into {}.{}", records.size(), name, tableName, e);
            throw new StorageException("Batch insert failed", name, tableName, e);
        }
    }
    
    @Override
    public Stream<Map<String, Object>> executeQuery(QuerySpec query, ExecutionContext context) {
        String table = SqlCriteriaTranslator.identifier(query.getTableName());
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table);
        List<Object> args = new ArrayList<>();
        query.getCriteria().ifPresent(criteria -> {
            SqlCriteriaTranslator.SqlFragment where = criteria.accept(translator);
            sql.append(" WHERE ").append(where.getClause());
            args.addAll(where.getArguments());
        });
        
        String statement = sql.toString();
        int fetchSize = query.getFetchSize();
        PreparedStatementCreator creator = connection -> {
            PreparedStatement ps = connection.prepareStatement(statement);
            ps.setFetchSize(fetchSize);
            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }
            return ps;
        };
        
        logger.debug("Executing on {}: {} {} [{}]", name, statement, args, context.getRequestId());
        Connection connection = null;
        try {
            connection = openCursorConnection();
            JdbcTemplate cursorTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
            Connection streamConnection = connection;
            return cursorTemplate.queryForStream(creator, new ColumnMapRowMapper())
                .onClose(() -> releaseCursorConnection(streamConnection, table));
        } catch (SQLException | DataAccessException e) {
            logger.error("Failed to query {}.{}", name, table, e);
            if (connection != null) {
                releaseCursorConnection(connection, table);
            }
            throw new StorageException("Query failed", name, table, e);
        }
    }
    
    private Connection openCursorConnection() throws SQLException {
        DataSource dataSource = jdbcTemplate.getDataSource();
        if (dataSource == null) {
            throw new IllegalStateException("JdbcTemplate of provider " + name + " has no DataSource");
        }
        Connection connection = dataSource.getConnection();
        try {
            connection.setAutoCommit(false);
            connection.setReadOnly(true);
            return connection;
        } catch (SQLException e) {
            JdbcUtils.closeConnection(connection);
            throw e;
        }
    }
    
    private void releaseCursorConnection(Connection connection, String table) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            logger.warn("Failed to end read transaction on {}.{}", name, table, e);
        } finally {
            JdbcUtils.closeConnection(connection);
        }
    }
    
    @Override
    public long delete(String tableName, QueryCriteria criteria, ExecutionContext context) {
        String table = SqlCriteriaTranslator.identifier(tableName);
        SqlCriteriaTranslator.SqlFragment where = criteria.accept(translator);
        String sql = "DELETE FROM " + table + " WHERE " + where.getClause();
        try {
            int deleted = jdbcTemplate.update(sql, where.getArguments().toArray());
            logger.debug("Deleted {} records from {}.{} where {} [{}]",
                deleted, name, table, criteria, context.getRequestId());
            return deleted;
        } catch (DataAccessException e) {
            logger.error("Failed to delete from {}.{} where {}", name, table, criteria, e);
            throw new StorageException("Delete failed", name, table, e);
        }
    }
    
    private String insertSql(String tableName, List<String> columns) {
        String table = SqlCriteriaTranslator.identifier(tableName);
        String columnList = columns.stream()
            .map(SqlCriteriaTranslator::identifier)
            .collect(Collectors.joining(", "));
        String placeholders = columns.stream()
            .map(column -> "?")
            .collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + columnList + ") VALUES (" + placeholders + ")";
    }
    
    @Override
    public String toString() {
        return "JdbcStorageProvider{name=" + name + ", technology=" + technologyType + '}';
    }
}
