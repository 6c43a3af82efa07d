package dev.henneberger.vertx.sync.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A selected table and how to replicate it. Built by the caller from its catalog.
 */
public final class SyncStream {

  private final String schema;
  private final String table;
  private final ReplicationMethod method;
  private final String replicationKey;
  private final List<String> keyProperties;
  private final Map<String, String> columnTypes;

  private SyncStream(Builder builder) {
    this.schema = builder.schema;
    this.table = builder.table;
    this.method = builder.method;
    this.replicationKey = builder.replicationKey;
    this.keyProperties = List.copyOf(builder.keyProperties);
    this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.columnTypes));
  }

  public static Builder builder(String schema, String table) {
    return new Builder(schema, table);
  }

  /**
   * Stream identity used for bookmarks and records: {@code schema-table}.
   */
  public String id() {
    return schema + '-' + table;
  }

  public String qualifiedTable() {
    return schema + '.' + table;
  }

  public String schema() {
    return schema;
  }

  public String table() {
    return table;
  }

  public ReplicationMethod method() {
    return method;
  }

  public String replicationKey() {
    return replicationKey;
  }

  public List<String> keyProperties() {
    return keyProperties;
  }

  /**
   * Column name to declared SQL type, in select order.
   */
  public Map<String, String> columnTypes() {
    return columnTypes;
  }

  @Override
  public String toString() {
    return id() + "(" + method + ")";
  }

  public static final class Builder {
    private final String schema;
    private final String table;
    private ReplicationMethod method = ReplicationMethod.FULL_TABLE;
    private String replicationKey;
    private List<String> keyProperties = List.of();
    private final Map<String, String> columnTypes = new LinkedHashMap<>();

    private Builder(String schema, String table) {
      this.schema = schema;
      this.table = table;
    }

    public Builder method(ReplicationMethod method) {
      this.method = Objects.requireNonNull(method, "method");
      return this;
    }

    public Builder replicationKey(String replicationKey) {
      this.replicationKey = replicationKey;
      return this;
    }

    public Builder keyProperties(String... keyProperties) {
      this.keyProperties = List.of(keyProperties);
      return this;
    }

    public Builder column(String name, String sqlType) {
      OptionValidation.require("column name", name);
      OptionValidation.require("column type", sqlType);
      columnTypes.put(name, sqlType);
      return this;
    }

    public SyncStream build() {
      OptionValidation.require("schema", schema);
      OptionValidation.require("table", table);
      if (columnTypes.isEmpty()) {
        throw new IllegalArgumentException("stream " + schema + "." + table + " has no columns");
      }
      if (method == ReplicationMethod.INCREMENTAL) {
        OptionValidation.require("replicationKey", replicationKey);
        if (!columnTypes.containsKey(replicationKey)) {
          throw new IllegalArgumentException("replicationKey " + replicationKey + " is not a column of " + schema + "." + table);
        }
      }
      for (String key : keyProperties) {
        if (!columnTypes.containsKey(key)) {
          throw new IllegalArgumentException("key property " + key + " is not a column of " + schema + "." + table);
        }
      }
      return new SyncStream(this);
    }
  }
}
