/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.textarchive.archive;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps entity types and partition keys to files under the archive root.
 * <p>
 * Paths stored in the relational store are relative to the root and use forward
 * slashes, so an archive directory can be moved or restored elsewhere.
 */
public final class ArchiveLayout {

    private final Path root;

    public ArchiveLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path resolve(EntityType type, PartitionKey key) {
        return resolve(type.relativePath(key));
    }

    public Path resolve(String relativePath) {
        return root.resolve(relativePath.replace('/', root.getFileSystem().getSeparator().charAt(0))).normalize();
    }

    /**
     * Path of {@code file} relative to the root, with forward slashes.
     *
     * @throws IllegalArgumentException if the file is outside the root
     */
    public String relativize(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            throw new IllegalArgumentException(file + " is outside the archive root " + root);
        }
        return root.relativize(absolute).toString().replace('\\', '/');
    }

    /**
     * Existing partitions of {@code type} in lexicographic order of their relative path,
     * which for date-named files is chronological order.
     */
    public List<Path> partitions(EntityType type) {
        Path base = type.baseDirectory().isEmpty() ? root : resolve(type.baseDirectory());
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(base)) {
            return files.filter(Files::isRegularFile)
                    .map(this::relativize)
                    .filter(type::isPartition)
                    .sorted()
                    .map(this::resolve)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArchiveIOException("Cannot list partitions of " + type + " under " + base, e);
        } catch (UncheckedIOException e) {
            throw new ArchiveIOException("Cannot list partitions of " + type + " under " + base, e.getCause());
        }
    }
}
