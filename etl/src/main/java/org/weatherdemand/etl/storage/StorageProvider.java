/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.weatherdemand.etl.storage;

import java.io.IOException;
import java.io.InputStream;

/**
 * Storage provider interface for abstracting file access across different
 * storage systems. Pipeline artifacts (raw payloads, processed tables,
 * quality reports) are written through it.
 */
public interface StorageProvider {

  /**
   * Opens an input stream for reading file content.
   *
   * @param path The file path
   * @return Input stream for the file
   * @throws IOException If an I/O error occurs
   */
  InputStream openInputStream(String path) throws IOException;

  /**
   * Checks if a path exists.
   *
   * @param path The path to check
   * @return true if the path exists
   * @throws IOException If an I/O error occurs
   */
  boolean exists(String path) throws IOException;

  /**
   * Gets the storage type identifier.
   *
   * @return Storage type (e.g., "local")
   */
  String getStorageType();

  /**
   * Resolves a relative path against a base path.
   *
   * @param basePath The base path
   * @param relativePath The relative path
   * @return The resolved path
   */
  String resolvePath(String basePath, String relativePath);

  /**
   * Writes content to a file.
   * Creates the file if it doesn't exist, overwrites if it does.
   *
   * @param path The file path
   * @param content The content to write
   * @throws IOException If an I/O error occurs
   * @throws UnsupportedOperationException If this storage provider is read-only
   */
  default void writeFile(String path, byte[] content) throws IOException {
    throw new UnsupportedOperationException(
        "Write operations are not supported by " + getStorageType() + " storage provider");
  }

  /**
   * Writes content to a file only if no file exists at the path. A file that
   * is created holds the complete content; a failed write leaves no file.
   *
   * @param path The file path
   * @param content The content to write
   * @return true if the file was created, false if it already existed
   * @throws IOException If an I/O error occurs
   */
  default boolean writeFileIfAbsent(String path, byte[] content) throws IOException {
    if (exists(path)) {
      return false;
    }
    writeFile(path, content);
    return true;
  }
}
