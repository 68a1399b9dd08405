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

package org.apache.tablemigration.model.catalog;

import lombok.NonNull;
import lombok.Value;

/**
 * A table or view known to the legacy metastore, as reported by the table inventory. Instances are
 * only used for lookups and are never persisted by the migration status crawler.
 */
@Value
public class LegacyTableView implements HierarchicalTableIdentifier {
  /** Name of the legacy catalog, usually {@code hive_metastore}. */
  @NonNull String catalog;

  /** Name of the legacy database (schema). */
  @NonNull String schema;

  /** Name of the table or view. */
  @NonNull String name;

  /** Lower-cased {@code catalog.schema.name}, the form recorded in back-reference properties. */
  public String getKey() {
    return getId();
  }

  @Override
  public String getCatalogName() {
    return catalog;
  }

  @Override
  public String getDatabaseName() {
    return schema;
  }

  @Override
  public String getTableName() {
    return name;
  }
}
