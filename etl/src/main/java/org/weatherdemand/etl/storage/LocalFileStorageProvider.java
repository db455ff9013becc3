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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * {@link StorageProvider} over the local file system.
 *
 * <p>Whole-file writes go to a sibling temporary file that is then moved into
 * place, so a reader never sees a half-written artifact.
 */
public class LocalFileStorageProvider implements StorageProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileStorageProvider.class);

  @Override public InputStream openInputStream(String path) throws IOException {
    return Files.newInputStream(Paths.get(path));
  }

  @Override public boolean exists(String path) {
    return Files.exists(Paths.get(path));
  }

  @Override public String getStorageType() {
    return "local";
  }

  @Override public String resolvePath(String basePath, String relativePath) {
    return Paths.get(basePath).resolve(relativePath).toString();
  }

  @Override public void writeFile(String path, byte[] content) throws IOException {
    Path target = Paths.get(path);
    ensureParent(target);
    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    Files.write(temp, content);
    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
        StandardCopyOption.ATOMIC_MOVE);
    LOGGER.debug("Wrote {} bytes to {}", content.length, target);
  }

  @Override public boolean writeFileIfAbsent(String path, byte[] content) throws IOException {
    Path target = Paths.get(path);
    ensureParent(target);
    if (Files.exists(target)) {
      LOGGER.debug("Not overwriting existing file {}", target);
      return false;
    }
    Path temp = Files.createTempFile(target.toAbsolutePath().getParent(),
        target.getFileName().toString(), ".tmp");
    try {
      Files.write(temp, content);
      // No REPLACE_EXISTING: a file created since the check above wins.
      Files.move(temp, target);
    } catch (FileAlreadyExistsException e) {
      LOGGER.debug("Not overwriting existing file {}", target);
      return false;
    } finally {
      Files.deleteIfExists(temp);
    }
    LOGGER.debug("Created {} ({} bytes)", target, content.length);
    return true;
  }

  private static void ensureParent(Path target) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }
}
