package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate of a retention sweep across all policies and tables.
 */
public final class RetentionResult {
    
    @JsonProperty("total_tables_processed")
    private final int totalTablesProcessed;
    
    @JsonProperty("successful_tables")
    private final int successfulTables;
    
    @JsonProperty("total_records_deleted")
    private final long totalRecordsDeleted;
    
    @JsonProperty("table_results")
    private final List<TableRetentionResult> tableResults;
    
    public RetentionResult(List<TableRetentionResult> tableResults) {
        this.tableResults = List.copyOf(tableResults);
        this.totalTablesProcessed = this.tableResults.size();
        this.successfulTables = (int) this.tableResults.stream()
            .filter(TableRetentionResult::isSuccess)
            .count();
        this.totalRecordsDeleted = this.tableResults.stream()
            .mapToLong(TableRetentionResult::getRecordsDeleted)
            .sum();
    }
    
    public int getTotalTablesProcessed() {
        return totalTablesProcessed;
    }
    
    public int getSuccessfulTables() {
        return successfulTables;
    }
    
    public long getTotalRecordsDeleted() {
        return totalRecordsDeleted;
    }
    
    public List<TableRetentionResult> getTableResults() {
        return tableResults;
    }
    
    @Override
    public String toString() {
        return "RetentionResult{tables=" + totalTablesProcessed + ", successful=" + successfulTables
            + ", recordsDeleted=" + totalRecordsDeleted + '}';
    }
}
