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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

public class TestMigrationDestination {

  @Test
  void testParseThreePartIdentity() {
    Optional<MigrationDestination> destination = MigrationDestination.parse("Main.Sales.Orders");
    assertEquals(Optional.of(new MigrationDestination("main", "sales", "orders")), destination);
    assertEquals("main", destination.get().getCatalog());
    assertEquals("sales", destination.get().getSchema());
    assertEquals("orders", destination.get().getTable());
    assertEquals("main.sales.orders", destination.get().getId());
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"sales.orders", "a.b.c.d", "orders", "main..orders", ".sales.orders", "main.sales."})
  void testParseRejectsMalformedIdentity(String identity) {
    assertFalse(MigrationDestination.parse(identity).isPresent());
  }

  @Test
  void testNullPartsAreRejected() {
    assertThrows(NullPointerException.class, () -> new MigrationDestination(null, "s", "t"));
  }
}
