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

package org.apache.tablemigration.model.sql;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/** One row of a statement result. Values are kept as returned by the warehouse, as text. */
@Value
public class SqlRow {
  @NonNull List<String> columnNames;
  @NonNull List<String> values;

  public String get(int position) {
    return values.get(position);
  }

  /**
   * @param columnName the result column name, matched case-insensitively
   * @throws IllegalArgumentException if the column is not part of the result
   */
  public String get(String columnName) {
    for (int i = 0; i < columnNames.size(); i++) {
      if (columnNames.get(i).equalsIgnoreCase(columnName)) {
        return values.get(i);
      }
    }
    throw new IllegalArgumentException("Unknown column " + columnName + " in " + columnNames);
  }

  public int size() {
    return values.size();
  }
}
