package com.telcobright.archive.db.entity;

import java.time.LocalDateTime;

/**
 * One archived sample row. Only the key columns are required; at most one
 * of the value columns is normally set, as indicated by datatype.
 */
public class Sample {
    
    private long channelId;
    private LocalDateTime sampleTime;
    private long nanosecs;
    private long severityId;
    private long statusId;
    private Integer numValue;
    private Float floatValue;
    private String stringValue;
    private String datatype = " ";
    private byte[] arrayValue;
    
    public Sample() {
    }
    
    public Sample(long channelId, LocalDateTime sampleTime, long nanosecs, long severityId, long statusId) {
        this.channelId = channelId;
        this.sampleTime = sampleTime;
        this.nanosecs = nanosecs;
        this.severityId = severityId;
        this.statusId = statusId;
    }
    
    public long getChannelId() { return channelId; }
    public void setChannelId(long channelId) { this.channelId = channelId; }
    
    public LocalDateTime getSampleTime() { return sampleTime; }
    public void setSampleTime(LocalDateTime sampleTime) { this.sampleTime = sampleTime; }
    
    public long getNanosecs() { return nanosecs; }
    public void setNanosecs(long nanosecs) { this.nanosecs = nanosecs; }
    
    public long getSeverityId() { return severityId; }
    public void setSeverityId(long severityId) { this.severityId = severityId; }
    
    public long getStatusId() { return statusId; }
    public void setStatusId(long statusId) { this.statusId = statusId; }
    
    public Integer getNumValue() { return numValue; }
    public void setNumValue(Integer numValue) { this.numValue = numValue; }
    
    public Float getFloatValue() { return floatValue; }
    public void setFloatValue(Float floatValue) { this.floatValue = floatValue; }
    
    public String getStringValue() { return stringValue; }
    public void setStringValue(String stringValue) { this.stringValue = stringValue; }
    
    public String getDatatype() { return datatype; }
    public void setDatatype(String datatype) { this.datatype = datatype; }
    
    public byte[] getArrayValue() { return arrayValue; }
    public void setArrayValue(byte[] arrayValue) { this.arrayValue = arrayValue; }
    
    @Override
    public String toString() {
        return String.format("Sample{channelId=%d, sampleTime=%s, nanosecs=%d}", channelId, sampleTime, nanosecs);
    }
}
