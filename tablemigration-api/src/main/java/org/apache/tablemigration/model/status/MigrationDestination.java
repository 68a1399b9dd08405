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

package org.apache.tablemigration.model.status;

import java.util.Locale;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

import org.apache.commons.lang3.StringUtils;

import org.apache.tablemigration.model.catalog.HierarchicalTableIdentifier;

/**
 * The Unity Catalog identity a legacy table was migrated to. All three parts are always present and
 * lower-cased, a record without a destination is simply not migrated.
 */
@Value
public class MigrationDestination implements HierarchicalTableIdentifier {
  @NonNull String catalog;
  @NonNull String schema;
  @NonNull String table;

  public MigrationDestination(
      @NonNull String catalog, @NonNull String schema, @NonNull String table) {
    this.catalog = catalog.toLowerCase(Locale.ROOT);
    this.schema = schema.toLowerCase(Locale.ROOT);
    this.table = table.toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a dotted {@code catalog.schema.table} identity.
   *
   * @param identity the identity as recorded on the migrated object
   * @return the destination, or empty if the identity does not split into exactly three non-empty
   *     parts
   */
  public static Optional<MigrationDestination> parse(String identity) {
    if (StringUtils.isBlank(identity)) {
      return Optional.empty();
    }
    String[] parts = identity.split("\\.", -1);
    if (parts.length != 3) {
      return Optional.empty();
    }
    for (String part : parts) {
      if (part.isEmpty()) {
        return Optional.empty();
      }
    }
    return Optional.of(new MigrationDestination(parts[0], parts[1], parts[2]));
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
    return table;
  }

  @Override
  public String toString() {
    return getId();
  }
}
