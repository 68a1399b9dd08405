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

package org.apache.tablemigration.legacy;

import static org.apache.tablemigration.crawler.SqlUtils.escapeSqlIdentifier;
import static org.apache.tablemigration.crawler.SqlUtils.toSqlLiteral;

import java.util.Optional;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import org.apache.tablemigration.model.sql.SqlRow;
import org.apache.tablemigration.spi.extractor.TablePropertyReader;
import org.apache.tablemigration.spi.sql.SqlBackend;

/**
 * Reads legacy table properties with {@code SHOW TBLPROPERTIES}. When the table lacks the property
 * the warehouse still returns a row, whose value reads {@code Table ... does not have property}.
 */
@Log4j2
public class SqlTablePropertyReader implements TablePropertyReader {
  static final String MISSING_PROPERTY_MESSAGE = "does not have property";

  private final SqlBackend sqlBackend;
  private final String legacyCatalog;

  public SqlTablePropertyReader(@NonNull SqlBackend sqlBackend, @NonNull String legacyCatalog) {
    this.sqlBackend = sqlBackend;
    this.legacyCatalog = legacyCatalog;
  }

  @Override
  public Optional<String> getTableProperty(String schema, String table, String key) {
    String statement =
        String.format(
            "SHOW TBLPROPERTIES %s.%s.%s (%s)",
            escapeSqlIdentifier(legacyCatalog),
            escapeSqlIdentifier(schema),
            escapeSqlIdentifier(table),
            toSqlLiteral(key));
    for (SqlRow row : sqlBackend.fetch(statement)) {
      if (row.size() == 0) {
        continue;
      }
      String value = row.get(row.size() - 1);
      if (value == null || value.contains(MISSING_PROPERTY_MESSAGE)) {
        continue;
      }
      return Optional.of(value);
    }
    log.debug("{}.{} has no {} property", schema, table, key);
    return Optional.empty();
  }
}
