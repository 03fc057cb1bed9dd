package com.strata.lifecycle;

import com.strata.domain.ExecutionContext;
import com.strata.domain.QueryCriteria;
import com.strata.domain.QuerySpec;
import com.strata.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Copies the records matching criteria from one provider to another in
 * bounded batches, then optionally deletes them from the source.
 *
 * Every batch is written before the source delete is issued. A failed or
 * cancelled batch aborts the move and the source is left untouched.
 * Records whose key the target already holds are not written again, so
 * repeating a move leaves the target unchanged.
 */
public class DataMover {
    
    private static final Logger logger = LoggerFactory.getLogger(DataMover.class);
    
    private final int batchSize;
    private final String recordKeyField;
    private final LifecycleMetrics metrics;
    
    public DataMover(int batchSize, String recordKeyField, LifecycleMetrics metrics) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        this.recordKeyField = recordKeyField;
        this.metrics = metrics;
    }
    
    /**
     * Moves records between providers
     *
     * @param source provider currently holding the records
     * @param target provider receiving the records, same table name
     * @param tableName table to move
     * @param criteria records to move
     * @param removeFromSource whether to delete the moved records from the source
     * @param operation tracked operation, checked for cancellation between batches
     * @param context execution context
     * @return counts of the completed move
     * @throws DataMoveException if any read, batch write or the source delete fails, or the operation is cancelled
     */
    public MoveOutcome move(StorageProvider source, StorageProvider target, String tableName,
                            QueryCriteria criteria, boolean removeFromSource,
                            LifecycleOperation operation, ExecutionContext context) {
        long recordsRead = 0;
        long recordsWritten = 0;
        long recordsSkipped = 0;
        int batches = 0;
        
        try {
            operation.checkNotCancelled();
            QuerySpec query = QuerySpec.of(tableName, criteria, batchSize);
            Set<String> targetKeys = existingKeys(target, query, context);
            try (Stream<Map<String, Object>> records = source.executeQuery(query, context)) {
                Iterator<Map<String, Object>> iterator = records.iterator();
                List<Map<String, Object>> batch = new ArrayList<>(batchSize);
                while (iterator.hasNext()) {
                    Map<String, Object> record = iterator.next();
                    recordsRead++;
                    Object key = record.get(recordKeyField);
                    if (key != null && targetKeys.contains(String.valueOf(key))) {
                        recordsSkipped++;
                        continue;
                    }
                    batch.add(record);
                    if (batch.size() == batchSize) {
                        recordsWritten += writeBatch(target, tableName, batch, operation, context);
                        batches++;
                        batch = new ArrayList<>(batchSize);
                    }
                }
                if (!batch.isEmpty()) {
                    recordsWritten += writeBatch(target, tableName, batch, operation, context);
                    batches++;
                }
            }
            
            long recordsDeleted = 0;
            if (removeFromSource && recordsWritten + recordsSkipped > 0) {
                operation.checkNotCancelled();
                recordsDeleted = source.delete(tableName, criteria, context);
                logger.debug("Removed {} moved records from {}.{} [{}]",
                    recordsDeleted, source.getName(), tableName, context.getRequestId());
            }
            
            logger.info("Moved {} records of {} from {} to {} in {} batches, {} already present [{}]",
                recordsWritten, tableName, source.getName(), target.getName(), batches, recordsSkipped,
                context.getRequestId());
            return new MoveOutcome(recordsRead, recordsWritten, recordsSkipped, recordsDeleted);
            
        } catch (OperationCancelledException e) {
            throw new DataMoveException("Move of " + tableName + " cancelled", recordsRead, e);
        } catch (RuntimeException e) {
            throw new DataMoveException("Move of " + tableName + " from " + source.getName() + " to "
                + target.getName() + " failed after " + batches + " batches: " + e.getMessage(), recordsRead, e);
        }
    }
    
    /**
     * Keys of the target records matching the move criteria
     */
    private Set<String> existingKeys(StorageProvider target, QuerySpec query, ExecutionContext context) {
        Set<String> keys = new HashSet<>();
        try (Stream<Map<String, Object>> records = target.executeQuery(query, context)) {
            records.map(record -> record.get(recordKeyField))
                .filter(key -> key != null)
                .forEach(key -> keys.add(String.valueOf(key)));
        }
        if (!keys.isEmpty()) {
            logger.debug("{} records of {} already on {} [{}]",
                keys.size(), query.getTableName(), target.getName(), context.getRequestId());
        }
        return keys;
    }
    
    private int writeBatch(StorageProvider target, String tableName, List<Map<String, Object>> batch,
                           LifecycleOperation operation, ExecutionContext context) {
        operation.checkNotCancelled();
        target.insertBatch(tableName, batch, context);
        metrics.recordMoved(batch.size());
        logger.debug("Wrote batch of {} records to {}.{} [{}]",
            batch.size(), target.getName(), tableName, context.getRequestId());
        return batch.size();
    }
    
    public int getBatchSize() {
        return batchSize;
    }
    
    /**
     * Counts of a completed move
     */
    public static final class MoveOutcome {
        private final long recordsRead;
        private final long recordsWritten;
        private final long recordsSkipped;
        private final long recordsDeleted;
        
        public MoveOutcome(long recordsRead, long recordsWritten, long recordsSkipped, long recordsDeleted) {
            this.recordsRead = recordsRead;
            this.recordsWritten = recordsWritten;
            this.recordsSkipped = recordsSkipped;
            this.recordsDeleted = recordsDeleted;
        }
        
        public long getRecordsRead() {
            return recordsRead;
        }
        
        public long getRecordsWritten() {
            return recordsWritten;
        }
        
        /**
         * Records read from the source that the target already held
         */
        public long getRecordsSkipped() {
            return recordsSkipped;
        }
        
        public long getRecordsDeleted() {
            return recordsDeleted;
        }
    }
}
