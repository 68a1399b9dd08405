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

/** Outcome of probing the legacy store for the migrated-to marker of a single table. */
public enum LiveMigrationState {
  /** The marker property is set on the legacy table. */
  MIGRATED,
  /** The legacy table exists and does not carry the marker. */
  NOT_MIGRATED,
  /**
   * The legacy table no longer exists. Treated as migrated by {@code isMigrated} so that it is not
   * picked up for migration again, although the table may simply have been dropped.
   */
  SOURCE_MISSING;

  /** Collapses the state to the boolean answer used by migration workflows. */
  public boolean countsAsMigrated() {
    return this != NOT_MIGRATED;
  }
}
