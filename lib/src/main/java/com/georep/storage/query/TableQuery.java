package com.georep.storage.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A query against one table: an optional raw filter expression, an optional
 * column projection and an optional take-count. The filter string is passed
 * to the service unchanged.
 */
public final class TableQuery {
    
    private final String tableName;
    private final String filter;
    private final List<String> selectColumns;
    private final Integer takeCount;
    
    private TableQuery(Builder builder) {
        this.tableName = builder.tableName;
        this.filter = builder.filter;
        this.selectColumns = List.copyOf(builder.selectColumns);
        this.takeCount = builder.takeCount;
    }
    
    public String getTableName() {
        return tableName;
    }
    
    public String getFilter() {
        return filter;
    }
    
    public List<String> getSelectColumns() {
        return selectColumns;
    }
    
    /**
     * Maximum number of entities to return across all pages, or {@code null} for all of them.
     */
    public Integer getTakeCount() {
        return takeCount;
    }
    
    public TakeBudget newBudget() {
        return takeCount == null ? TakeBudget.unbounded() : TakeBudget.of(takeCount);
    }
    
    public static Builder from(String tableName) {
        return new Builder(tableName);
    }
    
    public static class Builder {
        private final String tableName;
        private String filter;
        private final List<String> selectColumns = new ArrayList<>();
        private Integer takeCount;
        
        private Builder(String tableName) {
            this.tableName = tableName;
        }
        
        public Builder where(String filter) {
            this.filter = filter;
            return this;
        }
        
        public Builder select(String... columns) {
            selectColumns.addAll(Arrays.asList(columns));
            return this;
        }
        
        public Builder take(int takeCount) {
            if (takeCount <= 0) {
                throw new IllegalArgumentException("Take count must be positive, got " + takeCount);
            }
            this.takeCount = takeCount;
            return this;
        }
        
        public TableQuery build() {
            if (tableName == null || tableName.isBlank()) {
                throw new IllegalArgumentException("Table name is required");
            }
            for (String column : selectColumns) {
                if (column == null || column.isBlank()) {
                    throw new IllegalArgumentException("Projection column names must not be blank");
                }
            }
            return new TableQuery(this);
        }
    }
    
    @Override
    public String toString() {
        return String.format("TableQuery{table=%s, filter=%s, select=%s, take=%s}",
            tableName, filter, selectColumns, takeCount);
    }
}
