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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.databricks.sdk.core.DatabricksError;
import com.databricks.sdk.core.error.platform.NotFound;
import com.databricks.sdk.service.sql.ColumnInfo;
import com.databricks.sdk.service.sql.Disposition;
import com.databricks.sdk.service.sql.ExecuteStatementRequest;
import com.databricks.sdk.service.sql.ExecuteStatementRequestOnWaitTimeout;
import com.databricks.sdk.service.sql.Format;
import com.databricks.sdk.service.sql.ResultData;
import com.databricks.sdk.service.sql.ResultManifest;
import com.databricks.sdk.service.sql.ResultSchema;
import com.databricks.sdk.service.sql.ServiceError;
import com.databricks.sdk.service.sql.StatementExecutionAPI;
import com.databricks.sdk.service.sql.StatementResponse;
import com.databricks.sdk.service.sql.StatementState;
import com.databricks.sdk.service.sql.StatementStatus;

import org.apache.tablemigration.exception.CatalogException;
import org.apache.tablemigration.exception.ObjectNotFoundException;
import org.apache.tablemigration.model.sql.SqlRow;

@ExtendWith(MockitoExtension.class)
public class TestStatementExecutionSqlBackend {

  @Mock private StatementExecutionAPI mockStatementExecution;
  private StatementExecutionSqlBackend sqlBackend;

  @BeforeEach
  void setUp() {
    sqlBackend = new StatementExecutionSqlBackend(mockStatementExecution, "wh-1");
  }

  @Test
  void testExecute() {
    when(mockStatementExecution.executeStatement(any(ExecuteStatementRequest.class)))
        .thenReturn(succeeded());

    sqlBackend.execute("TRUNCATE TABLE `hive_metastore`.`ucx`.`migration_status`");

    ArgumentCaptor<ExecuteStatementRequest> requestCaptor =
        ArgumentCaptor.forClass(ExecuteStatementRequest.class);
    verify(mockStatementExecution).executeStatement(requestCaptor.capture());
    ExecuteStatementRequest request = requestCaptor.getValue();
    assertEquals("TRUNCATE TABLE `hive_metastore`.`ucx`.`migration_status`", request.getStatement());
    assertEquals("wh-1", request.getWarehouseId());
    assertEquals(Format.JSON_ARRAY, request.getFormat());
    assertEquals(Disposition.INLINE, request.getDisposition());
    assertEquals("30s", request.getWaitTimeout());
    assertEquals(ExecuteStatementRequestOnWaitTimeout.CANCEL, request.getOnWaitTimeout());
  }

  @Test
  void testFetchFollowsChunks() {
    when(mockStatementExecution.executeStatement(any(ExecuteStatementRequest.class)))
        .thenReturn(
            succeeded()
                .setStatementId("stmt-1")
                .setManifest(
                    new ResultManifest()
                        .setSchema(
                            new ResultSchema()
                                .setColumns(
                                    Arrays.asList(
                                        new ColumnInfo().setName("key"),
                                        new ColumnInfo().setName("value")))))
                .setResult(
                    new ResultData()
                        .setDataArray(data(Arrays.asList("upgraded_to", "main.sales.orders")))
                        .setNextChunkIndex(1L)));
    when(mockStatementExecution.getStatementResultChunkN("stmt-1", 1L))
        .thenReturn(new ResultData().setDataArray(data(Arrays.asList("owner", null))));

    List<SqlRow> rows = sqlBackend.fetch("SHOW TBLPROPERTIES `hive_metastore`.`sales`.`orders`");

    assertEquals(2, rows.size());
    assertEquals("main.sales.orders", rows.get(0).get("value"));
    assertEquals("owner", rows.get(1).get("KEY"));
    assertNull(rows.get(1).get(1));
  }

  @Test
  void testFetchWithoutResult() {
    when(mockStatementExecution.executeStatement(any(ExecuteStatementRequest.class)))
        .thenReturn(succeeded());

    assertTrue(sqlBackend.fetch("SELECT * FROM `hive_metastore`.`ucx`.`tables`").isEmpty());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "[TABLE_OR_VIEW_NOT_FOUND] The table or view `hive_metastore`.`sales`.`orders` cannot be found.",
        "[SCHEMA_NOT_FOUND] The schema `sales` cannot be found.",
        "org.apache.spark.sql.catalyst.analysis.NoSuchTableException: Table not found",
        "Table hive_metastore.sales.orders does not exist"
      })
  void testMissingObjectFailure(String errorMessage) {
    when(mockStatementExecution.executeStatement(any(ExecuteStatementRequest.class)))
        .thenReturn(failed(errorMessage));

    assertThrows(
        ObjectNotFoundException.class,
        () -> sqlBackend.fetch("SHOW TBLPROPERTIES `hive_metastore`.`sales`.`orders`"));
  }

  @Test
  void testOtherFailure() {
    when(mockStatementExecution.executeStatement(any(ExecuteStatementRequest.class)))
        .thenReturn(failed("[INSUFFICIENT_PERMISSIONS] User does not have MODIFY on table"));

    CatalogException e =
        assertThrows(CatalogException.class, () -> sqlBackend.execute("DELETE FROM x"));
    assertFalse(e instanceof ObjectNotFoundException);
    assertTrue(e.getMessage().contains("INSUFFICIENT_PERMISSIONS"));
  }

  @Test
  void testCanceledWithoutMessage() {
    when(mockStatementExecution.executeStatement(any(ExecuteStatementRequest.class)))
        .thenReturn(
            new StatementResponse()
                .setStatus(new StatementStatus().setState(StatementState.CANCELED)));

    CatalogException e =
        assertThrows(CatalogException.class, () -> sqlBackend.execute("SELECT 1"));
    assertFalse(e instanceof ObjectNotFoundException);
  }

  @Test
  void testSdkErrors() {
    when(mockStatementExecution.executeStatement(any(ExecuteStatementRequest.class)))
        .thenThrow(new NotFound("Warehouse wh-1 not found", Collections.emptyList()))
        .thenThrow(new DatabricksError("INTERNAL_ERROR", "Something went wrong"));

    assertThrows(ObjectNotFoundException.class, () -> sqlBackend.execute("SELECT 1"));
    CatalogException e =
        assertThrows(CatalogException.class, () -> sqlBackend.execute("SELECT 1"));
    assertFalse(e instanceof ObjectNotFoundException);
  }

  private static StatementResponse succeeded() {
    return new StatementResponse()
        .setStatus(new StatementStatus().setState(StatementState.SUCCEEDED));
  }

  private static StatementResponse failed(String errorMessage) {
    return new StatementResponse()
        .setStatus(
            new StatementStatus()
                .setState(StatementState.FAILED)
                .setError(new ServiceError().setMessage(errorMessage)));
  }

  @SafeVarargs
  private static Collection<Collection<String>> data(List<String>... rows) {
    Collection<Collection<String>> data = new ArrayList<>();
    data.addAll(Arrays.asList(rows));
    return data;
  }
}
