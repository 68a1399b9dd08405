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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import com.google.common.annotations.VisibleForTesting;

import com.databricks.sdk.WorkspaceClient;
import com.databricks.sdk.core.DatabricksError;
import com.databricks.sdk.core.error.platform.NotFound;
import com.databricks.sdk.service.sql.ColumnInfo;
import com.databricks.sdk.service.sql.Disposition;
import com.databricks.sdk.service.sql.ExecuteStatementRequest;
import com.databricks.sdk.service.sql.ExecuteStatementRequestOnWaitTimeout;
import com.databricks.sdk.service.sql.Format;
import com.databricks.sdk.service.sql.ResultData;
import com.databricks.sdk.service.sql.StatementExecutionAPI;
import com.databricks.sdk.service.sql.StatementResponse;
import com.databricks.sdk.service.sql.StatementState;

import org.apache.tablemigration.exception.CatalogException;
import org.apache.tablemigration.exception.ObjectNotFoundException;
import org.apache.tablemigration.model.sql.SqlRow;
import org.apache.tablemigration.spi.sql.SqlBackend;

/**
 * {@link SqlBackend} running statements on a Databricks SQL warehouse through the Statement
 * Execution API. Results are read inline as JSON arrays, following result chunks when the warehouse
 * splits a result.
 */
@Log4j2
public class StatementExecutionSqlBackend implements SqlBackend {
  static final String WAIT_TIMEOUT = "30s";
  private static final List<String> NOT_FOUND_ERRORS =
      Arrays.asList(
          "TABLE_OR_VIEW_NOT_FOUND",
          "SCHEMA_NOT_FOUND",
          "NoSuchTableException",
          "NoSuchDatabaseException",
          "does not exist");

  private final StatementExecutionAPI statementExecution;
  private final String warehouseId;

  public StatementExecutionSqlBackend(
      @NonNull WorkspaceClient workspaceClient, @NonNull String warehouseId) {
    this(workspaceClient.statementExecution(), warehouseId);
  }

  @VisibleForTesting
  StatementExecutionSqlBackend(
      @NonNull StatementExecutionAPI statementExecution, @NonNull String warehouseId) {
    this.statementExecution = statementExecution;
    this.warehouseId = warehouseId;
  }

  @Override
  public void execute(String statement) {
    executeStatement(statement);
  }

  @Override
  public List<SqlRow> fetch(String statement) {
    StatementResponse response = executeStatement(statement);
    List<String> columnNames = getColumnNames(response);
    List<SqlRow> rows = new ArrayList<>();
    ResultData result = response.getResult();
    while (result != null) {
      addRows(rows, columnNames, result.getDataArray());
      Long nextChunkIndex = result.getNextChunkIndex();
      if (nextChunkIndex == null) {
        break;
      }
      result = fetchChunk(response.getStatementId(), nextChunkIndex, statement);
    }
    log.debug("Fetched {} rows: {}", rows.size(), statement);
    return rows;
  }

  private StatementResponse executeStatement(String statement) {
    ExecuteStatementRequest request =
        new ExecuteStatementRequest()
            .setStatement(statement)
            .setWarehouseId(warehouseId)
            .setFormat(Format.JSON_ARRAY)
            .setDisposition(Disposition.INLINE)
            .setWaitTimeout(WAIT_TIMEOUT)
            .setOnWaitTimeout(ExecuteStatementRequestOnWaitTimeout.CANCEL);

    StatementResponse response;
    try {
      response = statementExecution.executeStatement(request);
    } catch (NotFound e) {
      throw new ObjectNotFoundException("Databricks statement failed: " + statement, e);
    } catch (DatabricksError e) {
      throw new CatalogException("Databricks statement failed: " + statement, e);
    }
    StatementState state = response.getStatus() == null ? null : response.getStatus().getState();
    if (state == StatementState.FAILED
        || state == StatementState.CANCELED
        || state == StatementState.CLOSED) {
      String errorMessage = null;
      if (response.getStatus().getError() != null) {
        errorMessage = response.getStatus().getError().getMessage();
      }
      if (StringUtils.isBlank(errorMessage)) {
        throw new CatalogException("Databricks statement " + state + ": " + statement);
      }
      String message = "Databricks statement failed: " + statement + " (" + errorMessage + ")";
      if (isNotFound(errorMessage)) {
        throw new ObjectNotFoundException(message);
      }
      throw new CatalogException(message);
    }
    return response;
  }

  private ResultData fetchChunk(String statementId, long chunkIndex, String statement) {
    try {
      return statementExecution.getStatementResultChunkN(statementId, chunkIndex);
    } catch (DatabricksError e) {
      throw new CatalogException(
          "Failed to fetch result chunk " + chunkIndex + " of statement: " + statement, e);
    }
  }

  private static boolean isNotFound(String errorMessage) {
    return NOT_FOUND_ERRORS.stream().anyMatch(errorMessage::contains);
  }

  private static List<String> getColumnNames(StatementResponse response) {
    if (response.getManifest() == null
        || response.getManifest().getSchema() == null
        || response.getManifest().getSchema().getColumns() == null) {
      return Collections.emptyList();
    }
    List<String> columnNames = new ArrayList<>();
    for (ColumnInfo column : response.getManifest().getSchema().getColumns()) {
      columnNames.add(column.getName());
    }
    return columnNames;
  }

  private static void addRows(
      List<SqlRow> rows, List<String> columnNames, Collection<Collection<String>> dataArray) {
    if (dataArray == null) {
      return;
    }
    for (Collection<String> values : dataArray) {
      rows.add(new SqlRow(columnNames, new ArrayList<>(values)));
    }
  }
}
