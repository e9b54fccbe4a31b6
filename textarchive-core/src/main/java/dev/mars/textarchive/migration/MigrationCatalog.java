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
package dev.mars.textarchive.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The known schema versions and their dependency graph.
 * <p>
 * A catalog directory (on the classpath or on disk) holds an {@code index} file listing
 * version ids, one per line ({@code #} starts a comment), and one sub-directory per id:
 * <pre>
 * migrations/
 *   index
 *   005_archive_path_columns/
 *     up.sql
 *     down.sql
 *     migration.properties   # description, depends_on, requires_maintenance_mode,
 *                            # estimated_duration_seconds, affected_tables
 * </pre>
 */
public final class MigrationCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationCatalog.class);

    public static final String DEFAULT_ROOT = "migrations";

    private final Map<String, SchemaVersion> versions;

    private MigrationCatalog(Collection<SchemaVersion> versions) {
        Map<String, SchemaVersion> byId = new LinkedHashMap<>();
        for (SchemaVersion v : versions) {
            if (byId.put(v.id(), v) != null) {
                throw new IllegalArgumentException("Duplicate schema version " + v.id());
            }
        }
        this.versions = byId;
        topologicalOrder();
    }

    public static MigrationCatalog of(SchemaVersion... versions) {
        return new MigrationCatalog(List.of(versions));
    }

    public static MigrationCatalog of(Collection<SchemaVersion> versions) {
        return new MigrationCatalog(versions);
    }

    /** The catalog bundled under {@code migrations/} on the classpath. */
    public static MigrationCatalog fromClasspath() {
        return fromClasspath(DEFAULT_ROOT);
    }

    public static MigrationCatalog fromClasspath(String root) {
        ClassLoader loader = MigrationCatalog.class.getClassLoader();
        return load(root, name -> {
            try (InputStream is = loader.getResourceAsStream(root + "/" + name)) {
                return is == null ? null : new String(is.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new MigrationException("Cannot read classpath resource " + root + "/" + name, e);
            }
        });
    }

    public static MigrationCatalog fromDirectory(Path dir) {
        return load(dir.toString(), name -> {
            Path file = dir.resolve(name);
            try {
                return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : null;
            } catch (IOException e) {
                throw new MigrationException("Cannot read " + file, e);
            }
        });
    }

    private static MigrationCatalog load(String root, Function<String, String> reader) {
        String index = reader.apply("index");
        if (index == null) {
            throw new MigrationException("No migration index found under " + root);
        }
        List<SchemaVersion> versions = new ArrayList<>();
        for (String raw : index.split("\\R")) {
            String id = raw.strip();
            if (id.isEmpty() || id.startsWith("#")) {
                continue;
            }
            String up = reader.apply(id + "/up.sql");
            if (up == null) {
                throw new MigrationException("Schema version " + id + " has no up.sql");
            }
            String down = reader.apply(id + "/down.sql");
            Properties meta = new Properties();
            String props = reader.apply(id + "/migration.properties");
            if (props != null) {
                try {
                    meta.load(new StringReader(props));
                } catch (IOException e) {
                    throw new MigrationException("Invalid migration.properties for " + id, e);
                }
            }
            versions.add(new SchemaVersion(
                    id,
                    meta.getProperty("description", ""),
                    up,
                    down,
                    Set.copyOf(list(meta.getProperty("depends_on"))),
                    Boolean.parseBoolean(meta.getProperty("requires_maintenance_mode", "false")),
                    Integer.parseInt(meta.getProperty("estimated_duration_seconds", "1").strip()),
                    list(meta.getProperty("affected_tables"))));
        }
        LOG.debug("Loaded {} schema versions from {}", versions.size(), root);
        return new MigrationCatalog(versions);
    }

    private static List<String> list(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public Optional<SchemaVersion> find(String id) {
        return Optional.ofNullable(versions.get(id));
    }

    public SchemaVersion get(String id) {
        SchemaVersion v = versions.get(id);
        if (v == null) {
            throw new MigrationException("Unknown schema version: " + id);
        }
        return v;
    }

    public Collection<SchemaVersion> all() {
        return versions.values();
    }

    /** Versions that list {@code id} as a direct dependency. */
    public Set<String> dependentsOf(String id) {
        Set<String> dependents = new TreeSet<>();
        for (SchemaVersion v : versions.values()) {
            if (v.dependsOn().contains(id)) {
                dependents.add(v.id());
            }
        }
        return dependents;
    }

    /**
     * All versions, every one after its dependencies. Ties are broken by id so the order
     * is deterministic.
     *
     * @throws DependencyException if a dependency is unknown or the graph has a cycle
     */
    public List<SchemaVersion> topologicalOrder() {
        Map<String, Integer> inDegree = new HashMap<>();
        for (SchemaVersion v : versions.values()) {
            for (String dep : v.dependsOn()) {
                if (!versions.containsKey(dep)) {
                    throw new DependencyException(v.id(), Set.of(dep),
                            "Schema version " + v.id() + " depends on unknown version " + dep);
                }
            }
            inDegree.put(v.id(), v.dependsOn().size());
        }

        TreeSet<String> ready = new TreeSet<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<SchemaVersion> ordered = new ArrayList<>(versions.size());
        while (!ready.isEmpty()) {
            String id = ready.pollFirst();
            ordered.add(versions.get(id));
            for (String dependent : dependentsOf(id)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() != versions.size()) {
            Set<String> cyclic = new HashSet<>(versions.keySet());
            ordered.forEach(v -> cyclic.remove(v.id()));
            throw new DependencyException(cyclic.iterator().next(), cyclic,
                    "Dependency cycle among schema versions " + new TreeSet<>(cyclic));
        }
        return ordered;
    }
}
