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

package org.apache.tablemigration.utilities;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashSet;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.MissingOptionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.databricks.sdk.WorkspaceClient;
import com.databricks.sdk.service.catalog.CatalogsAPI;
import com.databricks.sdk.service.catalog.SchemasAPI;
import com.databricks.sdk.service.catalog.TablesAPI;
import com.databricks.sdk.service.sql.StatementExecutionAPI;

import org.apache.tablemigration.config.TableMigrationStatusConfig;
import org.apache.tablemigration.databricks.DatabricksWorkspaceConfig;
import org.apache.tablemigration.exception.ConfigurationException;
import org.apache.tablemigration.status.TableMigrationStatusRefresher;

@ExtendWith(MockitoExtension.class)
public class TestRunMigrationStatusRefresh {

  @Mock private WorkspaceClient mockWorkspaceClient;

  @Test
  void testLoadConfig() throws Exception {
    TableMigrationStatusConfig config =
        RunMigrationStatusRefresh.loadConfig(resource("migration-status-config.yaml"));

    assertEquals("hive_metastore", config.getInventoryCatalog());
    assertEquals("ucx", config.getInventorySchema());
    assertEquals("migration_status_v2", config.getStatusTableName());
    assertEquals(
        new HashSet<>(Arrays.asList("SYSTEM_CATALOG", "DELTASHARING_CATALOG")),
        config.getSkipCatalogTypes());

    DatabricksWorkspaceConfig workspaceConfig =
        DatabricksWorkspaceConfig.from(config.getWorkspace());
    assertEquals("https://example.cloud.databricks.com", workspaceConfig.getHost());
    assertEquals("wh-1", workspaceConfig.getWarehouseId());
    assertEquals("client", workspaceConfig.getClientId());
  }

  @Test
  void testLoadConfigDefaults() throws Exception {
    TableMigrationStatusConfig config =
        RunMigrationStatusRefresh.loadConfig(resource("minimal-config.yaml"));

    assertEquals("migration_status", config.getStatusTableName());
    assertEquals("upgraded_from", config.getBackReferenceProperty());
    assertEquals("upgraded_to", config.getMigratedMarkerProperty());
    assertTrue(config.getWorkspace().isEmpty());
    assertThrows(
        ConfigurationException.class, () -> DatabricksWorkspaceConfig.from(config.getWorkspace()));
  }

  @Test
  void testLoadConfigWithoutInventorySchema() throws Exception {
    Path path = resource("missing-schema-config.yaml");
    assertThrows(ConfigurationException.class, () -> RunMigrationStatusRefresh.loadConfig(path));
  }

  @Test
  void testOptions() throws Exception {
    CommandLine cmd =
        new DefaultParser()
            .parse(
                RunMigrationStatusRefresh.OPTIONS,
                new String[] {"--config", "config.yaml", "-f", "-t", "sales.orders"});

    assertEquals("config.yaml", cmd.getOptionValue("c"));
    assertTrue(cmd.hasOption("forceRefresh"));
    assertEquals("sales.orders", cmd.getOptionValue("table"));
    assertThrows(
        MissingOptionException.class,
        () -> new DefaultParser().parse(RunMigrationStatusRefresh.OPTIONS, new String[] {"-f"}));
  }

  @Test
  void testParseTable() {
    assertArrayEquals(
        new String[] {"sales", "orders"}, RunMigrationStatusRefresh.parseTable("sales.orders"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"orders", "hive_metastore.sales.orders", "sales.", ".orders", ""})
  void testParseTableRejectsOtherNames(String value) {
    assertThrows(
        IllegalArgumentException.class, () -> RunMigrationStatusRefresh.parseTable(value));
  }

  @Test
  void testCreateRefresher() {
    when(mockWorkspaceClient.statementExecution())
        .thenReturn(mock(StatementExecutionAPI.class));
    when(mockWorkspaceClient.catalogs()).thenReturn(mock(CatalogsAPI.class));
    when(mockWorkspaceClient.schemas()).thenReturn(mock(SchemasAPI.class));
    when(mockWorkspaceClient.tables()).thenReturn(mock(TablesAPI.class));
    TableMigrationStatusConfig config =
        TableMigrationStatusConfig.builder().inventorySchema("ucx").build();

    TableMigrationStatusRefresher refresher =
        RunMigrationStatusRefresh.createRefresher(config, mockWorkspaceClient, "wh-1");

    assertEquals("hive_metastore.ucx.migration_status", refresher.getFullName());
  }

  private static Path resource(String name) throws URISyntaxException {
    return Paths.get(TestRunMigrationStatusRefresh.class.getClassLoader().getResource(name).toURI());
  }
}
