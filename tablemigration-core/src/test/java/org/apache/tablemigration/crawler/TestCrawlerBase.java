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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import org.apache.tablemigration.exception.CatalogException;
import org.apache.tablemigration.exception.ObjectNotFoundException;
import org.apache.tablemigration.exception.ReadException;
import org.apache.tablemigration.exception.WriteException;
import org.apache.tablemigration.model.sql.SqlRow;
import org.apache.tablemigration.spi.sql.SqlBackend;

@ExtendWith(MockitoExtension.class)
public class TestCrawlerBase {
  private static final String FULL_NAME = "`hive_metastore`.`ucx`.`grants`";

  @Mock private SqlBackend mockSqlBackend;

  @Test
  void testWritesInBatches() {
    List<String> names =
        IntStream.range(0, CrawlerBase.INSERT_BATCH_SIZE + 1)
            .mapToObj(i -> "t" + i)
            .collect(Collectors.toList());
    NameCrawler crawler = new NameCrawler(mockSqlBackend, names);

    assertEquals(names, crawler.snapshot(true));

    ArgumentCaptor<String> statements = ArgumentCaptor.forClass(String.class);
    verify(mockSqlBackend, times(3)).execute(statements.capture());
    assertEquals(
        "CREATE TABLE IF NOT EXISTS " + FULL_NAME + " (`name` STRING) USING DELTA",
        statements.getAllValues().get(0));
    assertTrue(statements.getAllValues().get(1).startsWith("INSERT OVERWRITE TABLE " + FULL_NAME));
    assertEquals(
        "INSERT INTO " + FULL_NAME + " VALUES ('t500')", statements.getAllValues().get(2));
    verify(mockSqlBackend, never()).fetch(anyString());
  }

  @Test
  void testCachedRowsAreNotCrawledAgain() {
    when(mockSqlBackend.fetch("SELECT * FROM " + FULL_NAME))
        .thenReturn(Collections.singletonList(row("cached")));
    NameCrawler crawler = new NameCrawler(mockSqlBackend, Collections.singletonList("fresh"));

    assertEquals(Collections.singletonList("cached"), crawler.snapshot());
    assertEquals(0, crawler.crawlCount);
  }

  @Test
  void testEmptyCacheIsCrawled() {
    when(mockSqlBackend.fetch("SELECT * FROM " + FULL_NAME)).thenReturn(Collections.emptyList());
    NameCrawler crawler = new NameCrawler(mockSqlBackend, Collections.singletonList("fresh"));

    assertEquals(Collections.singletonList("fresh"), crawler.snapshot());
    assertEquals(1, crawler.crawlCount);
    verify(mockSqlBackend).execute("INSERT OVERWRITE TABLE " + FULL_NAME + " VALUES ('fresh')");
  }

  @Test
  void testMalformedCachedRow() {
    when(mockSqlBackend.fetch("SELECT * FROM " + FULL_NAME))
        .thenReturn(
            Collections.singletonList(
                new SqlRow(Collections.singletonList("other"), Collections.singletonList("x"))));
    NameCrawler crawler = new NameCrawler(mockSqlBackend, Collections.emptyList());

    assertThrows(ReadException.class, crawler::snapshot);
  }

  @Test
  void testWriteFailure() {
    doThrow(new CatalogException("PERMISSION_DENIED"))
        .when(mockSqlBackend)
        .execute(startsWith("CREATE TABLE"));
    NameCrawler crawler = new NameCrawler(mockSqlBackend, Collections.singletonList("fresh"));

    assertThrows(WriteException.class, () -> crawler.snapshot(true));
  }

  @Test
  void testReset() {
    NameCrawler crawler = new NameCrawler(mockSqlBackend, Collections.emptyList());
    crawler.reset();
    verify(mockSqlBackend).execute("DELETE FROM " + FULL_NAME);

    doThrow(new ObjectNotFoundException("TABLE_OR_VIEW_NOT_FOUND"))
        .when(mockSqlBackend)
        .execute("DELETE FROM " + FULL_NAME);
    crawler.reset();
  }

  @Test
  void testRowSizeMismatch() {
    NameCrawler crawler =
        new NameCrawler(mockSqlBackend, Collections.singletonList("fresh")) {
          @Override
          protected List<String> toRow(String record) {
            return Arrays.asList(record, record);
          }
        };

    assertThrows(IllegalStateException.class, () -> crawler.snapshot(true));
  }

  private static SqlRow row(String name) {
    return new SqlRow(Collections.singletonList("name"), Collections.singletonList(name));
  }

  private static class NameCrawler extends CrawlerBase<String> {
    private final List<String> names;
    private int crawlCount;

    NameCrawler(SqlBackend sqlBackend, List<String> names) {
      super(sqlBackend, "hive_metastore", "ucx", "grants");
      this.names = names;
    }

    @Override
    protected List<String> crawl() {
      crawlCount++;
      return new ArrayList<>(names);
    }

    @Override
    protected Map<String, String> getColumns() {
      Map<String, String> columns = new LinkedHashMap<>();
      columns.put("name", "STRING");
      return columns;
    }

    @Override
    protected List<String> toRow(String record) {
      return Collections.singletonList(record);
    }

    @Override
    protected String fromRow(SqlRow row) {
      return row.get("name");
    }
  }
}
