/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.formc.codegen;

import static java.util.Objects.requireNonNull;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Text of a generated module, and the name of the file it belongs in. */
public final class GeneratedModule {
  public final String fileName;
  public final Language language;
  public final String text;

  GeneratedModule(String fileName, Language language, String text) {
    this.fileName = requireNonNull(fileName);
    this.language = requireNonNull(language);
    this.text = requireNonNull(text);
  }

  /**
   * Writes this module to a directory, and returns the file written.
   *
   * <p>The text is written to a temporary file in the same directory, which
   * is then moved into place, so that a reader never sees a partial file.
   */
  public File writeTo(File directory) throws IOException {
    final Path dir = directory.toPath();
    Files.createDirectories(dir);
    final Path target = dir.resolve(fileName);
    final Path tmp = Files.createTempFile(dir, "." + fileName, ".tmp");
    try {
      Files.write(tmp, text.getBytes(StandardCharsets.UTF_8));
      try {
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
    return target.toFile();
  }

  @Override
  public String toString() {
    return fileName;
  }
}

// End GeneratedModule.java
