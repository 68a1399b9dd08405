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

package org.apache.tablemigration.databricks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import com.google.common.annotations.VisibleForTesting;

import com.databricks.sdk.WorkspaceClient;
import com.databricks.sdk.core.DatabricksError;
import com.databricks.sdk.core.error.platform.NotFound;
import com.databricks.sdk.service.catalog.CatalogInfo;
import com.databricks.sdk.service.catalog.CatalogsAPI;
import com.databricks.sdk.service.catalog.ListCatalogsRequest;
import com.databricks.sdk.service.catalog.SchemaInfo;
import com.databricks.sdk.service.catalog.SchemasAPI;
import com.databricks.sdk.service.catalog.TableInfo;
import com.databricks.sdk.service.catalog.TablesAPI;

import org.apache.tablemigration.exception.CatalogException;
import org.apache.tablemigration.exception.ObjectNotFoundException;
import org.apache.tablemigration.model.metastore.CatalogDescriptor;
import org.apache.tablemigration.model.metastore.SchemaDescriptor;
import org.apache.tablemigration.model.metastore.TableDescriptor;
import org.apache.tablemigration.spi.extractor.MetadataStoreClient;

/**
 * Unity Catalog implementation of {@link MetadataStoreClient}.
 *
 * <p>The SDK pages through listings lazily, so each listing is read completely before returning
 * and errors surface at the call that caused them.
 */
@Log4j2
public class UnityCatalogMetadataStoreClient implements MetadataStoreClient {
  private final CatalogsAPI catalogsApi;
  private final SchemasAPI schemasApi;
  private final TablesAPI tablesApi;

  public UnityCatalogMetadataStoreClient(@NonNull WorkspaceClient workspaceClient) {
    this(workspaceClient.catalogs(), workspaceClient.schemas(), workspaceClient.tables());
  }

  @VisibleForTesting
  UnityCatalogMetadataStoreClient(
      @NonNull CatalogsAPI catalogsApi,
      @NonNull SchemasAPI schemasApi,
      @NonNull TablesAPI tablesApi) {
    this.catalogsApi = catalogsApi;
    this.schemasApi = schemasApi;
    this.tablesApi = tablesApi;
  }

  @Override
  public List<CatalogDescriptor> listCatalogs() {
    List<CatalogDescriptor> catalogs = new ArrayList<>();
    Iterable<CatalogInfo> listing =
        list("catalogs", () -> catalogsApi.list(new ListCatalogsRequest()));
    for (CatalogInfo catalog : listing) {
      if (catalog.getName() == null) {
        continue;
      }
      catalogs.add(
          CatalogDescriptor.builder()
              .name(catalog.getName())
              .catalogType(
                  catalog.getCatalogType() == null ? null : catalog.getCatalogType().name())
              .build());
    }
    return catalogs;
  }

  @Override
  public List<SchemaDescriptor> listSchemas(String catalogName) {
    List<SchemaDescriptor> schemas = new ArrayList<>();
    Iterable<SchemaInfo> listing =
        list("schemas in " + catalogName, () -> schemasApi.list(catalogName));
    for (SchemaInfo schema : listing) {
      if (schema.getName() == null) {
        continue;
      }
      schemas.add(
          SchemaDescriptor.builder().catalogName(catalogName).name(schema.getName()).build());
    }
    return schemas;
  }

  @Override
  public List<TableDescriptor> listTables(String catalogName, String schemaName) {
    List<TableDescriptor> tables = new ArrayList<>();
    String location = "tables in " + catalogName + "." + schemaName;
    for (TableInfo table : list(location, () -> tablesApi.list(catalogName, schemaName))) {
      tables.add(
          TableDescriptor.builder()
              .name(table.getName())
              .fullName(table.getFullName())
              .properties(
                  table.getProperties() == null
                      ? Collections.emptyMap()
                      : table.getProperties())
              .build());
    }
    return tables;
  }

  private static <T> List<T> list(String what, Supplier<Iterable<T>> listing) {
    try {
      List<T> items = new ArrayList<>();
      Iterable<T> pages = listing.get();
      if (pages != null) {
        pages.forEach(items::add);
      }
      log.debug("Listed {} {}", items.size(), what);
      return items;
    } catch (NotFound e) {
      throw new ObjectNotFoundException("Not found while listing " + what, e);
    } catch (DatabricksError e) {
      throw new CatalogException("Failed to list " + what, e);
    }
  }
}
