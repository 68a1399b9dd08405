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

package org.apache.tablemigration.status;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import com.google.common.annotations.VisibleForTesting;

import org.apache.tablemigration.config.TableMigrationStatusConfig;
import org.apache.tablemigration.crawler.CrawlerBase;
import org.apache.tablemigration.exception.CatalogException;
import org.apache.tablemigration.exception.ObjectNotFoundException;
import org.apache.tablemigration.model.catalog.LegacyTableView;
import org.apache.tablemigration.model.sql.SqlRow;
import org.apache.tablemigration.model.status.LiveMigrationState;
import org.apache.tablemigration.model.status.MigrationDestination;
import org.apache.tablemigration.model.status.TableMigrationIndex;
import org.apache.tablemigration.model.status.TableMigrationStatus;
import org.apache.tablemigration.spi.extractor.TableInventory;
import org.apache.tablemigration.spi.extractor.TablePropertyReader;
import org.apache.tablemigration.spi.sql.SqlBackend;

/**
 * Crawler capturing the migration status of every legacy table and view.
 *
 * <p>A pass first scans the new metadata store once for back-reference properties, which yields
 * candidate destinations for legacy tables in bulk. Each candidate is then confirmed by reading the
 * migrated-to marker of the legacy table before the destination is recorded. Tables without a
 * candidate are recorded as not migrated without any further call.
 */
@Log4j2
public class TableMigrationStatusRefresher extends CrawlerBase<TableMigrationStatus> {
  static final String SRC_SCHEMA = "src_schema";
  static final String SRC_TABLE = "src_table";
  static final String DST_CATALOG = "dst_catalog";
  static final String DST_SCHEMA = "dst_schema";
  static final String DST_TABLE = "dst_table";
  static final String UPDATE_TS = "update_ts";

  private final TableInventory tableInventory;
  private final SeenTableResolver seenTableResolver;
  private final TablePropertyReader tablePropertyReader;
  private final String migratedMarkerProperty;
  private final Clock clock;

  public TableMigrationStatusRefresher(
      SqlBackend sqlBackend,
      TableMigrationStatusConfig config,
      TableInventory tableInventory,
      SeenTableResolver seenTableResolver,
      TablePropertyReader tablePropertyReader) {
    this(
        sqlBackend,
        config,
        tableInventory,
        seenTableResolver,
        tablePropertyReader,
        Clock.systemUTC());
  }

  @VisibleForTesting
  TableMigrationStatusRefresher(
      SqlBackend sqlBackend,
      @NonNull TableMigrationStatusConfig config,
      @NonNull TableInventory tableInventory,
      @NonNull SeenTableResolver seenTableResolver,
      @NonNull TablePropertyReader tablePropertyReader,
      @NonNull Clock clock) {
    super(
        sqlBackend,
        config.getInventoryCatalog(),
        config.validate().getInventorySchema(),
        config.getStatusTableName());
    this.tableInventory = tableInventory;
    this.seenTableResolver = seenTableResolver;
    this.tablePropertyReader = tablePropertyReader;
    this.migratedMarkerProperty = config.getMigratedMarkerProperty();
    this.clock = clock;
  }

  public TableMigrationIndex index() {
    return index(false);
  }

  /**
   * Builds a lookup index over the migration status snapshot.
   *
   * @param forceRefresh recompute the snapshot from the live sources instead of the saved one
   */
  public TableMigrationIndex index(boolean forceRefresh) {
    return new TableMigrationIndex(snapshot(forceRefresh));
  }

  /** Destination full name mapped to legacy table key, for every back-referenced object. */
  public Map<String, String> getSeenTables() {
    return seenTableResolver.getSeenTables();
  }

  /**
   * Checks, without using the saved snapshot, whether a legacy table is marked as migrated. A table
   * that no longer exists counts as migrated so that it is not migrated again and views depending
   * on it are not blocked.
   */
  public boolean isMigrated(String schema, String table) {
    return checkLiveMigrationState(schema, table).countsAsMigrated();
  }

  /** Reads the migrated-to marker of a legacy table. */
  public LiveMigrationState checkLiveMigrationState(String schema, String table) {
    Optional<String> marker;
    try {
      marker = tablePropertyReader.getTableProperty(schema, table, migratedMarkerProperty);
    } catch (ObjectNotFoundException e) {
      log.warn("failed-to-migrate: {}.{} set as a source does no longer exist", schema, table);
      return LiveMigrationState.SOURCE_MISSING;
    }
    if (marker.isPresent()) {
      log.info("{}.{} is set as migrated", schema, table);
      return LiveMigrationState.MIGRATED;
    }
    log.info("{}.{} is set as not migrated", schema, table);
    return LiveMigrationState.NOT_MIGRATED;
  }

  @Override
  protected List<TableMigrationStatus> crawl() {
    List<LegacyTableView> allTables = tableInventory.snapshot();
    Map<String, String> reverseSeen = new HashMap<>();
    getSeenTables().forEach((destination, source) -> reverseSeen.put(source, destination));
    String updateTimestamp = formatTimestamp(clock.instant());

    List<TableMigrationStatus> statuses = new ArrayList<>(allTables.size());
    int migrated = 0;
    for (LegacyTableView table : allTables) {
      TableMigrationStatus status =
          TableMigrationStatus.notMigrated(table.getSchema(), table.getName(), updateTimestamp);
      String targetTable = findTargetTable(reverseSeen, table);
      if (targetTable != null
          && confirmMigrated(status.getSourceSchema(), status.getSourceTable())) {
        Optional<MigrationDestination> destination = MigrationDestination.parse(targetTable);
        if (destination.isPresent()) {
          status = status.withDestination(destination.get());
          migrated++;
        } else {
          log.warn("Ignoring malformed destination {} for {}", targetTable, table.getKey());
        }
      }
      statuses.add(status);
    }
    log.info("Crawled migration status of {} tables, {} migrated", statuses.size(), migrated);
    return statuses;
  }

  private boolean confirmMigrated(String schema, String table) {
    try {
      return isMigrated(schema, table);
    } catch (CatalogException e) {
      log.warn(
          "Cannot read the migration marker of {}.{}, recording it as not migrated",
          schema,
          table,
          e);
      return false;
    }
  }

  /**
   * Back-references normally name the legacy table as {@code catalog.schema.table}; references
   * recorded without the legacy catalog are accepted too.
   */
  private static String findTargetTable(Map<String, String> reverseSeen, LegacyTableView table) {
    String targetTable = reverseSeen.get(table.getKey());
    if (targetTable == null) {
      targetTable =
          reverseSeen.get((table.getSchema() + "." + table.getName()).toLowerCase(Locale.ROOT));
    }
    return targetTable;
  }

  @Override
  protected Map<String, String> getColumns() {
    Map<String, String> columns = new LinkedHashMap<>();
    columns.put(SRC_SCHEMA, "STRING");
    columns.put(SRC_TABLE, "STRING");
    columns.put(DST_CATALOG, "STRING");
    columns.put(DST_SCHEMA, "STRING");
    columns.put(DST_TABLE, "STRING");
    columns.put(UPDATE_TS, "STRING");
    return columns;
  }

  @Override
  protected List<String> toRow(TableMigrationStatus status) {
    return Arrays.asList(
        status.getSourceSchema(),
        status.getSourceTable(),
        status.getDestinationCatalog(),
        status.getDestinationSchema(),
        status.getDestinationTable(),
        status.getUpdateTimestamp());
  }

  @Override
  protected TableMigrationStatus fromRow(SqlRow row) {
    String dstCatalog = row.get(DST_CATALOG);
    String dstSchema = row.get(DST_SCHEMA);
    String dstTable = row.get(DST_TABLE);
    MigrationDestination destination = null;
    if (dstCatalog != null && dstSchema != null && dstTable != null) {
      destination = new MigrationDestination(dstCatalog, dstSchema, dstTable);
    }
    return new TableMigrationStatus(
        row.get(SRC_SCHEMA), row.get(SRC_TABLE), destination, row.get(UPDATE_TS));
  }

  /** Seconds since epoch with microsecond precision, e.g. {@code 1700000000.123456}. */
  static String formatTimestamp(Instant instant) {
    return String.format(
        Locale.ROOT, "%d.%06d", instant.getEpochSecond(), instant.getNano() / 1_000);
  }
}
