package com.telcobright.archive.core.config;

import com.telcobright.archive.core.partition.Granularity;
import com.telcobright.archive.core.routing.DispatchStrategy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Properties;

/**
 * Arguments of a scheduled maintenance run plus the scheduling knobs.
 */
public class MaintenanceConfig {

    private final LocalDateTime beginTime;
    private final String schema;
    private final String owner;
    private final Granularity granularity;
    private final DispatchStrategy dispatchStrategy;
    private final LocalTime adjustmentTime;
    private final ZoneId zone;
    private final boolean createParentTable;

    private MaintenanceConfig(Builder builder) {
        this.beginTime = builder.beginTime;
        this.schema = builder.schema;
        this.owner = builder.owner;
        this.granularity = builder.granularity;
        this.dispatchStrategy = builder.dispatchStrategy;
        this.adjustmentTime = builder.adjustmentTime;
        this.zone = builder.zone;
        this.createParentTable = builder.createParentTable;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read archive.maintenance.* keys: begin-time, schema, owner, plan,
     * dispatch-strategy, adjustment-time, zone, create-parent-table.
     */
    public static MaintenanceConfig fromProperties(Properties properties) {
        Builder builder = builder()
            .schema(properties.getProperty("archive.maintenance.schema", "archive"))
            .owner(properties.getProperty("archive.maintenance.owner"))
            .plan(properties.getProperty("archive.maintenance.plan", "month"))
            .adjustmentTime(properties.getProperty("archive.maintenance.adjustment-time", "04:00"))
            .createParentTable(Boolean.parseBoolean(
                properties.getProperty("archive.maintenance.create-parent-table", "false")));

        String beginTime = properties.getProperty("archive.maintenance.begin-time");
        if (beginTime != null) {
            builder.beginTime(parseBeginTime(beginTime.trim()));
        }
        String strategy = properties.getProperty("archive.maintenance.dispatch-strategy");
        if (strategy != null) {
            builder.dispatchStrategy(DispatchStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT)));
        }
        String zone = properties.getProperty("archive.maintenance.zone");
        if (zone != null) {
            builder.zone(ZoneId.of(zone.trim()));
        }
        return builder.build();
    }

    /**
     * Accepts 2012-06-01 or 2012-06-01T00:00[:00]
     */
    static LocalDateTime parseBeginTime(String value) {
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            return LocalDate.parse(value).atStartOfDay();
        }
    }

    public LocalDateTime getBeginTime() { return beginTime; }
    public String getSchema() { return schema; }
    public String getOwner() { return owner; }
    public Granularity getGranularity() { return granularity; }
    public DispatchStrategy getDispatchStrategy() { return dispatchStrategy; }
    public LocalTime getAdjustmentTime() { return adjustmentTime; }
    public ZoneId getZone() { return zone; }
    public boolean isCreateParentTable() { return createParentTable; }

    @Override
    public String toString() {
        return String.format("Maintenance[%s.sample, owner=%s, plan=%s, begin=%s]",
            schema, owner, granularity.getPlan(), beginTime);
    }

    public static class Builder {
        private LocalDateTime beginTime;
        private String schema = "archive";
        private String owner;
        private Granularity granularity = Granularity.MONTH;
        private DispatchStrategy dispatchStrategy = DispatchStrategy.BINARY_SEARCH;
        private LocalTime adjustmentTime = LocalTime.of(4, 0);
        private ZoneId zone = ZoneId.systemDefault();
        private boolean createParentTable = false;

        public Builder beginTime(LocalDateTime beginTime) {
            this.beginTime = beginTime;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder granularity(Granularity granularity) {
            this.granularity = granularity;
            return this;
        }

        /**
         * Plan keyword: day, week, month or year
         */
        public Builder plan(String plan) {
            this.granularity = Granularity.fromPlan(plan);
            return this;
        }

        public Builder dispatchStrategy(DispatchStrategy dispatchStrategy) {
            this.dispatchStrategy = dispatchStrategy;
            return this;
        }

        public Builder adjustmentTime(LocalTime adjustmentTime) {
            this.adjustmentTime = adjustmentTime;
            return this;
        }

        /**
         * Time of day in HH:mm format (e.g. "04:00")
         */
        public Builder adjustmentTime(String adjustmentTime) {
            this.adjustmentTime = LocalTime.parse(adjustmentTime, DateTimeFormatter.ofPattern("HH:mm"));
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder createParentTable(boolean createParentTable) {
            this.createParentTable = createParentTable;
            return this;
        }

        public MaintenanceConfig build() {
            if (beginTime == null) {
                throw new IllegalArgumentException("Begin time is required");
            }
            if (schema == null || schema.trim().isEmpty()) {
                throw new IllegalArgumentException("Schema cannot be null or empty");
            }
            if (owner == null || owner.trim().isEmpty()) {
                throw new IllegalArgumentException("Owner cannot be null or empty");
            }
            if (granularity == null || dispatchStrategy == null || adjustmentTime == null || zone == null) {
                throw new IllegalArgumentException("Granularity, dispatch strategy, adjustment time and zone are required");
            }
            return new MaintenanceConfig(this);
        }
    }
}
