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

import java.util.Locale;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Migration status of a single legacy table, as produced by one crawl pass. The pair {@code
 * (sourceSchema, sourceTable)} identifies the record and is unique within a snapshot.
 */
@Value
public class TableMigrationStatus {
  /** Lower-cased legacy database name. */
  @NonNull String sourceSchema;

  /** Lower-cased legacy table name. */
  @NonNull String sourceTable;

  /** Where the table was migrated to, null while the table is not migrated. */
  @With MigrationDestination destination;

  /**
   * Seconds since epoch, as text, at which the crawl pass producing this record started. Shared by
   * every record of the same pass.
   */
  String updateTimestamp;

  public TableMigrationStatus(
      @NonNull String sourceSchema,
      @NonNull String sourceTable,
      MigrationDestination destination,
      String updateTimestamp) {
    this.sourceSchema = sourceSchema.toLowerCase(Locale.ROOT);
    this.sourceTable = sourceTable.toLowerCase(Locale.ROOT);
    this.destination = destination;
    this.updateTimestamp = updateTimestamp;
  }

  public static TableMigrationStatus notMigrated(
      String sourceSchema, String sourceTable, String updateTimestamp) {
    return new TableMigrationStatus(sourceSchema, sourceTable, null, updateTimestamp);
  }

  public Optional<MigrationDestination> getDestination() {
    return Optional.ofNullable(destination);
  }

  public boolean isMigrated() {
    return destination != null;
  }

  /** The lower-cased {@code catalog.schema.table} of the destination, if migrated. */
  public Optional<String> getDestinationIdentity() {
    return getDestination().map(MigrationDestination::getId);
  }

  public String getDestinationCatalog() {
    return destination == null ? null : destination.getCatalog();
  }

  public String getDestinationSchema() {
    return destination == null ? null : destination.getSchema();
  }

  public String getDestinationTable() {
    return destination == null ? null : destination.getTable();
  }
}
