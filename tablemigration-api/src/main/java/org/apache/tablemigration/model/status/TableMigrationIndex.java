/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.tablemigration.model.status;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.NonNull;
import lombok.Value;

/**
 * Immutable point-lookup index over the records of a migration status snapshot. The index is never
 * updated, a new snapshot means a new index. Once constructed it is safe to share between threads.
 */
public class TableMigrationIndex {
  private final Map<SourceTableKey, TableMigrationStatus> index;

  public TableMigrationIndex(@NonNull Iterable<TableMigrationStatus> statuses) {
    Map<SourceTableKey, TableMigrationStatus> entries = new HashMap<>();
    for (TableMigrationStatus status : statuses) {
      entries.put(SourceTableKey.of(status.getSourceSchema(), status.getSourceTable()), status);
    }
    this.index = Collections.unmodifiableMap(entries);
  }

  /**
   * Checks if a legacy table is migrated. A table that is known but has no destination is not
   * migrated.
   */
  public boolean isMigrated(String schema, String table) {
    return get(schema, table).isPresent();
  }

  /**
   * Returns the migration status of a legacy table. Empty when the table is unknown and also when
   * it is known but not migrated.
   */
  public Optional<TableMigrationStatus> get(String schema, String table) {
    TableMigrationStatus status = index.get(SourceTableKey.of(schema, table));
    if (status == null || !status.isMigrated()) {
      return Optional.empty();
    }
    return Optional.of(status);
  }

  /** The {@code (schema, table)} keys of every table in the snapshot, migrated or not. */
  public Set<SourceTableKey> snapshot() {
    return index.keySet();
  }

  public int size() {
    return index.size();
  }

  /** Lower-cased {@code (schema, table)} pair identifying a legacy table. */
  @Value
  public static class SourceTableKey {
    String schema;
    String table;

    public static SourceTableKey of(@NonNull String schema, @NonNull String table) {
      return new SourceTableKey(schema.toLowerCase(Locale.ROOT), table.toLowerCase(Locale.ROOT));
    }
  }
}
