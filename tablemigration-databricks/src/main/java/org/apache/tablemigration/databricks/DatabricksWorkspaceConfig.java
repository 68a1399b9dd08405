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

import java.util.Map;

import lombok.NonNull;
import lombok.Value;

import org.apache.commons.lang3.StringUtils;

import org.apache.tablemigration.exception.ConfigurationException;

/** Connection settings of a Databricks workspace and the SQL warehouse statements run on. */
@Value
public class DatabricksWorkspaceConfig {
  public static final String HOST = "host";
  public static final String WAREHOUSE_ID = "warehouseId";
  public static final String AUTH_TYPE = "authType";
  public static final String CLIENT_ID = "clientId";
  public static final String CLIENT_SECRET = "clientSecret";
  public static final String TOKEN = "token";

  String host;
  String warehouseId;
  String authType;
  String clientId;
  String clientSecret;
  String token;

  /**
   * @throws ConfigurationException if host or warehouse id is missing
   */
  public static DatabricksWorkspaceConfig from(@NonNull Map<String, String> props) {
    DatabricksWorkspaceConfig config =
        new DatabricksWorkspaceConfig(
            props.get(HOST),
            props.get(WAREHOUSE_ID),
            props.get(AUTH_TYPE),
            props.get(CLIENT_ID),
            props.get(CLIENT_SECRET),
            props.get(TOKEN));
    if (StringUtils.isBlank(config.getHost()) || StringUtils.isBlank(config.getWarehouseId())) {
      throw new ConfigurationException(
          "Databricks workspace requires " + HOST + " and " + WAREHOUSE_ID);
    }
    return config;
  }

  @Override
  public String toString() {
    return "DatabricksWorkspaceConfig(host=" + host + ", warehouseId=" + warehouseId + ")";
  }
}
