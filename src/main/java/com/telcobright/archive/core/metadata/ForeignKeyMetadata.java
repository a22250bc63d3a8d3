package com.telcobright.archive.core.metadata;

/**
 * A foreign key from a sample column to a lookup relation in the same schema.
 * Bucket tables carry these with ON DELETE CASCADE.
 */
public class ForeignKeyMetadata {
    
    private final String columnName;
    private final String referencedTable;
    private final String referencedColumn;
    
    public ForeignKeyMetadata(String columnName, String referencedTable, String referencedColumn) {
        this.columnName = columnName;
        this.referencedTable = referencedTable;
        this.referencedColumn = referencedColumn;
    }
    
    /**
     * Constraint name on a given bucket table, e.g. sample_m201206_channel_id_fkey
     */
    public String constraintName(String tableName) {
        return tableName + "_" + columnName + "_fkey";
    }
    
    public String getColumnName() { return columnName; }
    public String getReferencedTable() { return referencedTable; }
    public String getReferencedColumn() { return referencedColumn; }
}
