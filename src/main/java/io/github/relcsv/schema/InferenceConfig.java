package io.github.relcsv.schema;

import java.util.Locale;
import java.util.Objects;

/**
 * Configuration options for schema inference.
 *
 * <p>This class uses the builder pattern for configuration and is immutable
 * once constructed.</p>
 */
public final class InferenceConfig {

    public static final String DEFAULT_ROOT_TABLE_NAME = "root";
    public static final String DEFAULT_ROOT_ARRAY_FIELD = "items";

    private final RowOrder rowOrder;
    private final DriftPolicy driftPolicy;
    private final String rootTableName;
    private final String rootArrayField;

    private InferenceConfig(Builder builder) {
        this.rowOrder = builder.rowOrder;
        this.driftPolicy = builder.driftPolicy;
        this.rootTableName = builder.rootTableName;
        this.rootArrayField = builder.rootArrayField;
    }

    /**
     * Returns a builder with default settings.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration.
     */
    public static InferenceConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a configuration that reproduces the row layout of the first json2relcsv
     * releases: newest row first in every table.
     */
    public static InferenceConfig legacy() {
        return builder()
                .rowOrder(RowOrder.PREPEND)
                .build();
    }

    /**
     * Returns a configuration that fails on any structural drift.
     */
    public static InferenceConfig strict() {
        return builder()
                .driftPolicy(DriftPolicy.FAIL)
                .build();
    }

    public RowOrder getRowOrder() {
        return rowOrder;
    }

    public DriftPolicy getDriftPolicy() {
        return driftPolicy;
    }

    public String getRootTableName() {
        return rootTableName;
    }

    public String getRootArrayField() {
        return rootArrayField;
    }

    public Builder toBuilder() {
        return builder()
                .rowOrder(rowOrder)
                .driftPolicy(driftPolicy)
                .rootTableName(rootTableName)
                .rootArrayField(rootArrayField);
    }

    @Override
    public String toString() {
        return "InferenceConfig{rowOrder=" + rowOrder + ", driftPolicy=" + driftPolicy
                + ", rootTableName='" + rootTableName + "', rootArrayField='" + rootArrayField + "'}";
    }

    // Enums

    public enum RowOrder {
        /** Rows are written in document order */
        APPEND,
        /** Each new row goes in front of the previous ones, giving reverse document order */
        PREPEND;

        public static RowOrder parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum DriftPolicy {
        /** Report the drift and keep the table's existing columns */
        WARN,
        /** Report the drift and add the new fields as columns */
        EXTEND,
        /** Throw a {@link StructuralDriftException} */
        FAIL;

        public static DriftPolicy parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    // Builder

    public static final class Builder {
        private RowOrder rowOrder = RowOrder.APPEND;
        private DriftPolicy driftPolicy = DriftPolicy.WARN;
        private String rootTableName = DEFAULT_ROOT_TABLE_NAME;
        private String rootArrayField = DEFAULT_ROOT_ARRAY_FIELD;

        public Builder rowOrder(RowOrder order) {
            this.rowOrder = Objects.requireNonNull(order, "rowOrder");
            return this;
        }

        public Builder driftPolicy(DriftPolicy policy) {
            this.driftPolicy = Objects.requireNonNull(policy, "driftPolicy");
            return this;
        }

        public Builder rootTableName(String name) {
            this.rootTableName = requireName(name, "rootTableName");
            return this;
        }

        public Builder rootArrayField(String field) {
            this.rootArrayField = requireName(field, "rootArrayField");
            return this;
        }

        public InferenceConfig build() {
            return new InferenceConfig(this);
        }

        private static String requireName(String value, String what) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException(what + " must not be empty");
            }
            return value.trim();
        }
    }
}
