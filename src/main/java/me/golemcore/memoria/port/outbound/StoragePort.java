package me.golemcore.memoria.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Document store holding the memory tiers.
 *
 * <p>
 * Every operation is asynchronous and may complete exceptionally. Callers in
 * the domain layer treat failures as "no data" and keep going.
 */
public interface StoragePort {

    /**
     * Write text content to a document, creating parent folders as needed.
     *
     * @param directory
     *            top-level folder (e.g., "TagProfilingNote", "SummaryNote")
     * @param path
     *            relative path within the folder
     * @param content
     *            document text
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read a document. Completes with {@code null} when the document does not
     * exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if a document exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a document.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List documents by prefix, as paths relative to the folder.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Atomically write text content with optional backup.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>If backup enabled: copy existing file to .bak</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     *
     * @param directory
     *            top-level folder
     * @param path
     *            relative path within the folder
     * @param content
     *            text content to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
