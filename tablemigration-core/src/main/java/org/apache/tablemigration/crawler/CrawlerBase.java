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

import static org.apache.tablemigration.crawler.SqlUtils.escapeSqlIdentifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import com.google.common.collect.Lists;

import org.apache.tablemigration.exception.CatalogException;
import org.apache.tablemigration.exception.ObjectNotFoundException;
import org.apache.tablemigration.exception.ReadException;
import org.apache.tablemigration.exception.WriteException;
import org.apache.tablemigration.model.sql.SqlRow;
import org.apache.tablemigration.spi.sql.SqlBackend;

/**
 * Base class for crawlers whose results are cached in a table of the warehouse.
 *
 * <p>{@link #snapshot(boolean)} serves the cached rows when present; otherwise, or when a refresh
 * is forced, it runs {@link #crawl()} and replaces the content of the backing table with the new
 * result.
 *
 * @param <T> the record type produced by the crawler
 */
@Log4j2
public abstract class CrawlerBase<T> {
  static final int INSERT_BATCH_SIZE = 500;

  protected final SqlBackend sqlBackend;
  @Getter private final String catalog;
  @Getter private final String schema;
  @Getter private final String table;

  protected CrawlerBase(
      @NonNull SqlBackend sqlBackend,
      @NonNull String catalog,
      @NonNull String schema,
      @NonNull String table) {
    this.sqlBackend = sqlBackend;
    this.catalog = catalog;
    this.schema = schema;
    this.table = table;
  }

  public String getFullName() {
    return catalog + "." + schema + "." + table;
  }

  public List<T> snapshot() {
    return snapshot(false);
  }

  /**
   * Returns the crawl result, from the backing table unless {@code forceRefresh} is set or nothing
   * is cached yet.
   *
   * @param forceRefresh crawl again and overwrite the backing table even if rows are cached
   */
  public List<T> snapshot(boolean forceRefresh) {
    if (!forceRefresh) {
      List<T> cached = fetchCached();
      if (!cached.isEmpty()) {
        log.debug("Using {} cached rows from {}", cached.size(), getFullName());
        return cached;
      }
    }
    List<T> crawled = Collections.unmodifiableList(new ArrayList<>(crawl()));
    overwrite(crawled);
    return crawled;
  }

  /** Removes the cached rows so that the next {@link #snapshot()} crawls again. */
  public void reset() {
    try {
      sqlBackend.execute("DELETE FROM " + escapeSqlIdentifier(getFullName()));
    } catch (ObjectNotFoundException e) {
      log.debug("Nothing to reset, {} does not exist", getFullName());
    }
  }

  /** Computes the records from the live sources. */
  protected abstract List<T> crawl();

  /**
   * Column names mapped to their Spark SQL types. The map iterates in table order, e.g. a {@link
   * LinkedHashMap}.
   */
  protected abstract Map<String, String> getColumns();

  /** Values of a record in the order of {@link #getColumns()}, null for SQL NULL. */
  protected abstract List<String> toRow(T record);

  protected abstract T fromRow(SqlRow row);

  private List<T> fetchCached() {
    List<SqlRow> rows;
    try {
      rows = sqlBackend.fetch("SELECT * FROM " + escapeSqlIdentifier(getFullName()));
    } catch (ObjectNotFoundException e) {
      log.debug("{} does not exist yet, crawling", getFullName());
      return Collections.emptyList();
    }
    List<T> records = new ArrayList<>(rows.size());
    for (SqlRow row : rows) {
      try {
        records.add(fromRow(row));
      } catch (RuntimeException e) {
        throw new ReadException("Malformed row in " + getFullName() + ": " + row.getValues(), e);
      }
    }
    return records;
  }

  private void overwrite(List<T> records) {
    String escapedName = escapeSqlIdentifier(getFullName());
    try {
      sqlBackend.execute(createTableStatement(escapedName));
      if (records.isEmpty()) {
        sqlBackend.execute("TRUNCATE TABLE " + escapedName);
        return;
      }
      boolean first = true;
      for (List<T> batch : Lists.partition(records, INSERT_BATCH_SIZE)) {
        String insertMode = first ? "INSERT OVERWRITE TABLE " : "INSERT INTO ";
        sqlBackend.execute(insertMode + escapedName + " VALUES " + toValues(batch));
        first = false;
      }
    } catch (CatalogException e) {
      throw new WriteException("Failed to save crawl results to " + getFullName(), e);
    }
    log.info("Saved {} rows to {}", records.size(), getFullName());
  }

  private String createTableStatement(String escapedName) {
    String columns =
        getColumns().entrySet().stream()
            .map(column -> escapeSqlIdentifier(column.getKey()) + " " + column.getValue())
            .collect(Collectors.joining(", "));
    return String.format("CREATE TABLE IF NOT EXISTS %s (%s) USING DELTA", escapedName, columns);
  }

  private String toValues(List<T> batch) {
    int columnCount = getColumns().size();
    List<String> tuples = new ArrayList<>(batch.size());
    for (T record : batch) {
      List<String> row = toRow(record);
      if (row.size() != columnCount) {
        throw new IllegalStateException(
            String.format(
                "Row has %d values but %s has %d columns", row.size(), getFullName(), columnCount));
      }
      tuples.add(
          row.stream().map(SqlUtils::toSqlLiteral).collect(Collectors.joining(", ", "(", ")")));
    }
    return String.join(", ", tuples);
  }
}
