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

package org.apache.tablemigration.legacy;

import static org.apache.tablemigration.crawler.SqlUtils.escapeSqlIdentifier;

import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import org.apache.tablemigration.config.TableMigrationStatusConfig;
import org.apache.tablemigration.model.catalog.LegacyTableView;
import org.apache.tablemigration.model.sql.SqlRow;
import org.apache.tablemigration.spi.extractor.TableInventory;
import org.apache.tablemigration.spi.sql.SqlBackend;

/**
 * Reads the legacy tables and views from the {@code tables} inventory table written by the table
 * crawler.
 */
@Log4j2
public class TablesInventoryReader implements TableInventory {
  static final String INVENTORY_TABLE_NAME = "tables";

  private final SqlBackend sqlBackend;
  private final String inventoryCatalog;
  private final String inventorySchema;

  public TablesInventoryReader(
      @NonNull SqlBackend sqlBackend,
      @NonNull String inventoryCatalog,
      @NonNull String inventorySchema) {
    this.sqlBackend = sqlBackend;
    this.inventoryCatalog = inventoryCatalog;
    this.inventorySchema = inventorySchema;
  }

  public TablesInventoryReader(SqlBackend sqlBackend, TableMigrationStatusConfig config) {
    this(sqlBackend, config.getInventoryCatalog(), config.validate().getInventorySchema());
  }

  @Override
  public List<LegacyTableView> snapshot() {
    String fullName = inventoryCatalog + "." + inventorySchema + "." + INVENTORY_TABLE_NAME;
    List<SqlRow> rows =
        sqlBackend.fetch(
            "SELECT catalog, database, name FROM " + escapeSqlIdentifier(fullName));
    List<LegacyTableView> tables = new ArrayList<>(rows.size());
    for (SqlRow row : rows) {
      if (StringUtils.isAnyBlank(row.get("database"), row.get("name"))) {
        log.warn(
            "Skipping inventory row without database or name in {}: {}",
            fullName,
            row.getValues());
        continue;
      }
      String catalog = StringUtils.defaultIfBlank(row.get("catalog"), inventoryCatalog);
      tables.add(new LegacyTableView(catalog, row.get("database"), row.get("name")));
    }
    log.debug("Read {} legacy tables from {}", tables.size(), fullName);
    return tables;
  }
}
