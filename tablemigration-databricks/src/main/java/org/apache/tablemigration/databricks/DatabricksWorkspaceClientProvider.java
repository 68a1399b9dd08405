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

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import com.databricks.sdk.WorkspaceClient;
import com.databricks.sdk.core.DatabricksConfig;

/** Creates workspace clients from {@link DatabricksWorkspaceConfig}. */
@Log4j2
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class DatabricksWorkspaceClientProvider {
  static final String OAUTH_M2M = "oauth-m2m";
  static final String PAT = "pat";

  public static WorkspaceClient getWorkspaceClient(DatabricksWorkspaceConfig config) {
    log.info("Connecting to Databricks workspace {}", config.getHost());
    return new WorkspaceClient(buildConfig(config));
  }

  static DatabricksConfig buildConfig(DatabricksWorkspaceConfig config) {
    DatabricksConfig dbConfig = new DatabricksConfig().setHost(config.getHost());
    if (!StringUtils.isBlank(config.getAuthType())) {
      dbConfig.setAuthType(config.getAuthType());
    }
    if (!StringUtils.isBlank(config.getClientId())
        && !StringUtils.isBlank(config.getClientSecret())) {
      dbConfig.setClientId(config.getClientId());
      dbConfig.setClientSecret(config.getClientSecret());
      if (StringUtils.isBlank(config.getAuthType())) {
        dbConfig.setAuthType(OAUTH_M2M);
      }
    } else if (!StringUtils.isBlank(config.getToken())) {
      dbConfig.setToken(config.getToken());
      if (StringUtils.isBlank(config.getAuthType())) {
        dbConfig.setAuthType(PAT);
      }
    }
    return dbConfig;
  }
}
