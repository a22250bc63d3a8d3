package com.telcobright.archive.core.metadata;

/**
 * Metadata for a single column of the sample table
 */
public class ColumnMetadata {
    
    private final String columnName;
    private final String sqlType;
    private final boolean nullable;
    private final String defaultValue;
    
    public ColumnMetadata(String columnName, String sqlType, boolean nullable) {
        this(columnName, sqlType, nullable, null);
    }
    
    public ColumnMetadata(String columnName, String sqlType, boolean nullable, String defaultValue) {
        this.columnName = columnName;
        this.sqlType = sqlType;
        this.nullable = nullable;
        this.defaultValue = defaultValue;
    }
    
    public String getColumnDefinition() {
        StringBuilder def = new StringBuilder();
        def.append(columnName).append(" ").append(sqlType);
        def.append(nullable ? " NULL" : " NOT NULL");
        if (defaultValue != null) {
            def.append(" DEFAULT ").append(defaultValue);
        }
        return def.toString();
    }
    
    public String getColumnName() { return columnName; }
    public String getSqlType() { return sqlType; }
    public boolean isNullable() { return nullable; }
    public String getDefaultValue() { return defaultValue; }
}
