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

package org.apache.tablemigration.config;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import org.apache.commons.lang3.StringUtils;

import org.apache.tablemigration.exception.ConfigurationException;

/** Configuration of the migration status crawler, usually loaded from a yaml file. */
@Value
@Builder
@Jacksonized
public class TableMigrationStatusConfig {
  public static final String DEFAULT_INVENTORY_CATALOG = "hive_metastore";
  public static final String DEFAULT_STATUS_TABLE_NAME = "migration_status";
  public static final String DEFAULT_BACK_REFERENCE_PROPERTY = "upgraded_from";
  public static final String DEFAULT_MIGRATED_MARKER_PROPERTY = "upgraded_to";
  public static final String SYSTEM_CATALOG_TYPE = "SYSTEM_CATALOG";

  /**
   * Catalog holding the legacy tables and the inventory schema. Also used as the catalog of the
   * legacy table keys recorded in back-reference properties.
   */
  @NonNull @Builder.Default String inventoryCatalog = DEFAULT_INVENTORY_CATALOG;

  /** Schema holding the legacy table inventory and the migration status table. */
  String inventorySchema;

  /** Name of the table the migration status snapshot is saved to. */
  @NonNull @Builder.Default String statusTableName = DEFAULT_STATUS_TABLE_NAME;

  /** Property set on migrated Unity Catalog objects, naming the legacy table they came from. */
  @NonNull @Builder.Default String backReferenceProperty = DEFAULT_BACK_REFERENCE_PROPERTY;

  /** Property set on legacy tables once they have been migrated. */
  @NonNull @Builder.Default String migratedMarkerProperty = DEFAULT_MIGRATED_MARKER_PROPERTY;

  /** Catalog types never scanned for back-references. */
  @NonNull @Builder.Default
  Set<String> skipCatalogTypes = Collections.singleton(SYSTEM_CATALOG_TYPE);

  /** Connection properties of the workspace, interpreted by the catalog adapter. */
  @NonNull @Builder.Default Map<String, String> workspace = Collections.emptyMap();

  /**
   * @throws ConfigurationException if a required setting is missing
   */
  public TableMigrationStatusConfig validate() {
    if (StringUtils.isBlank(inventorySchema)) {
      throw new ConfigurationException("inventorySchema is required");
    }
    if (StringUtils.isBlank(backReferenceProperty) || StringUtils.isBlank(migratedMarkerProperty)) {
      throw new ConfigurationException(
          "backReferenceProperty and migratedMarkerProperty must be set");
    }
    return this;
  }
}
