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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import com.databricks.sdk.WorkspaceClient;

import org.apache.tablemigration.config.TableMigrationStatusConfig;
import org.apache.tablemigration.databricks.DatabricksWorkspaceClientProvider;
import org.apache.tablemigration.databricks.DatabricksWorkspaceConfig;
import org.apache.tablemigration.databricks.StatementExecutionSqlBackend;
import org.apache.tablemigration.databricks.UnityCatalogMetadataStoreClient;
import org.apache.tablemigration.exception.ConfigurationException;
import org.apache.tablemigration.legacy.SqlTablePropertyReader;
import org.apache.tablemigration.legacy.TablesInventoryReader;
import org.apache.tablemigration.model.status.LiveMigrationState;
import org.apache.tablemigration.model.status.TableMigrationIndex;
import org.apache.tablemigration.spi.sql.SqlBackend;
import org.apache.tablemigration.status.SeenTableResolver;
import org.apache.tablemigration.status.TableMigrationStatusRefresher;

/**
 * Provides a standalone process for refreshing the migration status of the legacy tables of a
 * workspace, or for checking a single legacy table against its migrated-to marker.
 */
@Log4j2
public class RunMigrationStatusRefresh {
  public static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final String CONFIG_PATH = "c";
  private static final String FORCE_REFRESH = "f";
  private static final String TABLE = "t";
  private static final String HELP_OPTION = "h";

  static final Options OPTIONS =
      new Options()
          .addRequiredOption(
              CONFIG_PATH,
              "config",
              true,
              "The path to a yaml file containing the inventory location and workspace connection")
          .addOption(
              FORCE_REFRESH,
              "forceRefresh",
              false,
              "Recompute the migration status even if a saved snapshot exists")
          .addOption(
              TABLE,
              "table",
              true,
              "Only check whether the given legacy table, as schema.table, is marked as migrated")
          .addOption(HELP_OPTION, "help", false, "Displays help information to run this utility");

  public static void main(String[] args) throws IOException {
    CommandLineParser parser = new DefaultParser();
    CommandLine cmd;
    try {
      cmd = parser.parse(OPTIONS, args);
    } catch (ParseException e) {
      new HelpFormatter().printHelp("tablemigration.jar", OPTIONS, true);
      return;
    }

    if (cmd.hasOption(HELP_OPTION)) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp("RunMigrationStatusRefresh", OPTIONS);
      return;
    }

    TableMigrationStatusConfig config = loadConfig(Paths.get(cmd.getOptionValue(CONFIG_PATH)));
    DatabricksWorkspaceConfig workspaceConfig =
        DatabricksWorkspaceConfig.from(config.getWorkspace());
    TableMigrationStatusRefresher refresher =
        createRefresher(
            config,
            DatabricksWorkspaceClientProvider.getWorkspaceClient(workspaceConfig),
            workspaceConfig.getWarehouseId());

    if (cmd.hasOption(TABLE)) {
      String[] schemaAndTable = parseTable(cmd.getOptionValue(TABLE));
      LiveMigrationState state =
          refresher.checkLiveMigrationState(schemaAndTable[0], schemaAndTable[1]);
      log.info("{} is {}", cmd.getOptionValue(TABLE), state);
      return;
    }

    TableMigrationIndex index = refresher.index(cmd.hasOption(FORCE_REFRESH));
    long migrated =
        index.snapshot().stream()
            .filter(key -> index.isMigrated(key.getSchema(), key.getTable()))
            .count();
    log.info(
        "{} of {} legacy tables are migrated, status saved in {}",
        migrated,
        index.size(),
        refresher.getFullName());
  }

  /**
   * @throws ConfigurationException if the file does not describe a valid configuration
   */
  static TableMigrationStatusConfig loadConfig(Path path) throws IOException {
    TableMigrationStatusConfig config;
    try (InputStream inputStream = Files.newInputStream(path)) {
      config = YAML_MAPPER.readValue(inputStream, TableMigrationStatusConfig.class);
    }
    if (config == null) {
      throw new ConfigurationException("Empty configuration file " + path);
    }
    return config.validate();
  }

  static TableMigrationStatusRefresher createRefresher(
      TableMigrationStatusConfig config, WorkspaceClient workspaceClient, String warehouseId) {
    SqlBackend sqlBackend = new StatementExecutionSqlBackend(workspaceClient, warehouseId);
    return new TableMigrationStatusRefresher(
        sqlBackend,
        config,
        new TablesInventoryReader(sqlBackend, config),
        new SeenTableResolver(new UnityCatalogMetadataStoreClient(workspaceClient), config),
        new SqlTablePropertyReader(sqlBackend, config.getInventoryCatalog()));
  }

  /**
   * Splits {@code schema.table}.
   *
   * @throws IllegalArgumentException if the value is not a two-part name
   */
  static String[] parseTable(String value) {
    String[] parts = StringUtils.defaultString(value).split("\\.", -1);
    if (parts.length != 2 || StringUtils.isAnyBlank(parts)) {
      throw new IllegalArgumentException(
          "Expected a legacy table as schema.table but got: " + value);
    }
    return parts;
  }
}
