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

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import org.apache.tablemigration.config.TableMigrationStatusConfig;
import org.apache.tablemigration.exception.CatalogException;
import org.apache.tablemigration.exception.ObjectNotFoundException;
import org.apache.tablemigration.model.metastore.CatalogDescriptor;
import org.apache.tablemigration.model.metastore.SchemaDescriptor;
import org.apache.tablemigration.model.metastore.TableDescriptor;
import org.apache.tablemigration.spi.extractor.MetadataStoreClient;

/**
 * Finds the objects of the new metadata store that were migrated from a legacy table. Migrated
 * objects carry a back-reference property naming their legacy source; the resolver scans every
 * catalog, schema and table for it.
 *
 * <p>The scan is best effort: catalogs and schemas that vanish or fail to list are logged and
 * skipped, the remainder is still scanned.
 */
@Log4j2
public class SeenTableResolver {
  private final MetadataStoreClient metadataStoreClient;
  private final String backReferenceProperty;
  private final Set<String> skipCatalogTypes;

  public SeenTableResolver(
      @NonNull MetadataStoreClient metadataStoreClient,
      @NonNull String backReferenceProperty,
      @NonNull Set<String> skipCatalogTypes) {
    this.metadataStoreClient = metadataStoreClient;
    this.backReferenceProperty = backReferenceProperty;
    Set<String> types = new HashSet<>();
    for (String type : skipCatalogTypes) {
      types.add(type.toUpperCase(Locale.ROOT));
    }
    this.skipCatalogTypes = Collections.unmodifiableSet(types);
  }

  public SeenTableResolver(
      MetadataStoreClient metadataStoreClient, TableMigrationStatusConfig config) {
    this(metadataStoreClient, config.getBackReferenceProperty(), config.getSkipCatalogTypes());
  }

  /**
   * Scans the metadata store.
   *
   * @return lower-cased destination full name mapped to the lower-cased legacy table key it was
   *     migrated from
   */
  public Map<String, String> getSeenTables() {
    Map<String, String> seenTables = new HashMap<>();
    for (CatalogDescriptor catalog : listCatalogs()) {
      for (SchemaDescriptor schema : listSchemas(catalog)) {
        for (TableDescriptor table : listTables(schema)) {
          String source = table.getProperties().get(backReferenceProperty);
          if (source == null) {
            continue;
          }
          if (StringUtils.isBlank(table.getFullName())) {
            log.warn("The table {} in {} has no full name", table.getName(), schema.getFullName());
            continue;
          }
          seenTables.put(
              table.getFullName().toLowerCase(Locale.ROOT), source.toLowerCase(Locale.ROOT));
        }
      }
    }
    log.info(
        "Found {} migrated objects with a {} property", seenTables.size(), backReferenceProperty);
    return seenTables;
  }

  private List<CatalogDescriptor> listCatalogs() {
    List<CatalogDescriptor> catalogs;
    try {
      catalogs = metadataStoreClient.listCatalogs();
    } catch (CatalogException e) {
      log.error("Cannot list catalogs", e);
      return Collections.emptyList();
    }
    return catalogs.stream()
        .filter(catalog -> !isSkipped(catalog))
        .collect(Collectors.toList());
  }

  private boolean isSkipped(CatalogDescriptor catalog) {
    return catalog.getCatalogType() != null
        && skipCatalogTypes.contains(catalog.getCatalogType().toUpperCase(Locale.ROOT));
  }

  private List<SchemaDescriptor> listSchemas(CatalogDescriptor catalog) {
    try {
      return metadataStoreClient.listSchemas(catalog.getName());
    } catch (ObjectNotFoundException e) {
      log.warn(
          "Catalog {} no longer exists. Skipping checking its migration status.",
          catalog.getName());
    } catch (CatalogException e) {
      log.warn("Error while listing schemas in catalog: {}", catalog.getName(), e);
    }
    return Collections.emptyList();
  }

  private List<TableDescriptor> listTables(SchemaDescriptor schema) {
    try {
      return metadataStoreClient.listTables(schema.getCatalogName(), schema.getName());
    } catch (ObjectNotFoundException e) {
      log.warn(
          "Schema {} no longer exists. Skipping checking its migration status.",
          schema.getFullName());
    } catch (CatalogException e) {
      log.warn("Error while listing tables in schema: {}", schema.getFullName(), e);
    }
    return Collections.emptyList();
  }
}
