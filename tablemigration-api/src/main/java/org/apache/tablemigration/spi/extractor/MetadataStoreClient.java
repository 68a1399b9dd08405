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

package org.apache.tablemigration.spi.extractor;

import java.util.List;

import org.apache.tablemigration.model.metastore.CatalogDescriptor;
import org.apache.tablemigration.model.metastore.SchemaDescriptor;
import org.apache.tablemigration.model.metastore.TableDescriptor;

/**
 * Read access to the catalogs, schemas and tables of the new metadata store.
 *
 * <p>Every listing may throw {@link org.apache.tablemigration.exception.ObjectNotFoundException}
 * when the parent object disappeared, or {@link
 * org.apache.tablemigration.exception.CatalogException} for any other remote failure.
 */
public interface MetadataStoreClient {

  List<CatalogDescriptor> listCatalogs();

  List<SchemaDescriptor> listSchemas(String catalogName);

  List<TableDescriptor> listTables(String catalogName, String schemaName);
}
