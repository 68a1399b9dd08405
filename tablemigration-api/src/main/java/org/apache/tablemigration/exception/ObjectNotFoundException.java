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

package org.apache.tablemigration.exception;

import org.apache.tablemigration.model.exception.ErrorCode;

/**
 * Thrown when a catalog, schema or table no longer exists. Callers decide whether a vanished
 * object is fatal, most scans treat it as a skip.
 */
public class ObjectNotFoundException extends CatalogException {
  public ObjectNotFoundException(String message, Throwable e) {
    super(ErrorCode.OBJECT_NOT_FOUND, message, e);
  }

  public ObjectNotFoundException(String message) {
    super(ErrorCode.OBJECT_NOT_FOUND, message);
  }
}
