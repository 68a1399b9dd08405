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

package org.apache.tablemigration.crawler;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/** Helpers for rendering identifiers and values into Spark SQL statements. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class SqlUtils {
  private static final int MAX_IDENTIFIER_PARTS = 3;

  /**
   * Escapes a possibly dotted identifier, e.g. {@code catalog.schema.table}, by wrapping each part
   * in backticks. Only the first two dots separate parts, so a table name may contain dots.
   */
  public static String escapeSqlIdentifier(String path) {
    if (path == null || path.isEmpty()) {
      return path;
    }
    String[] parts = path.split("\\.", MAX_IDENTIFIER_PARTS);
    StringBuilder escaped = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        escaped.append('.');
      }
      escaped.append(quoteIdentifierPart(parts[i]));
    }
    return escaped.toString();
  }

  /** Renders a value as a string literal, or {@code NULL}. */
  public static String toSqlLiteral(String value) {
    if (value == null) {
      return "NULL";
    }
    return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }

  private static String quoteIdentifierPart(String part) {
    String unquoted = part;
    while (unquoted.startsWith("`")) {
      unquoted = unquoted.substring(1);
    }
    while (unquoted.endsWith("`")) {
      unquoted = unquoted.substring(0, unquoted.length() - 1);
    }
    return "`" + unquoted.replace("`", "``") + "`";
  }
}
