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
package dev.mars.textarchive.demo;

import dev.mars.textarchive.ArchiveConfig;
import dev.mars.textarchive.archive.ArchiveReader;
import dev.mars.textarchive.archive.ArchiveWriter;
import dev.mars.textarchive.archive.EntityType;
import dev.mars.textarchive.consistency.ConsistencyValidator;
import dev.mars.textarchive.consistency.StoreSnapshot;
import dev.mars.textarchive.migration.MigrationCatalog;
import dev.mars.textarchive.migration.MigrationManager;
import dev.mars.textarchive.migration.MigrationStatus;
import dev.mars.textarchive.migration.StartupDecision;
import dev.mars.textarchive.recovery.RecoveryOrchestrator;
import dev.mars.textarchive.recovery.RecoveryPlan;
import dev.mars.textarchive.recovery.RecoveryReport;
import dev.mars.textarchive.service.ArchiveFirstService;
import dev.mars.textarchive.store.CanonicalRecord;
import dev.mars.textarchive.store.JdbcCanonicalStore;
import dev.mars.textarchive.store.NaturalKey;
import org.h2.jdbcx.JdbcDataSource;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Demo entry point for the text archive.
 * <p>
 * This demonstrates the archive-first cycle:
 * <ul>
 *   <li>Applying schema versions on startup</li>
 *   <li>Recovering rows archived by earlier runs</li>
 *   <li>Writing users, a prayer and its activity through the archive</li>
 *   <li>Wiping the store and rebuilding it from the archive</li>
 *   <li>Comparing row counts before and after</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link ArchiveConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (archive directory only)</li>
 *   <li>System properties: {@code -Dtextarchive.archiveDir=/path -Dtextarchive.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code TEXTARCHIVE_ARCHIVE_DIR, TEXTARCHIVE_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code textarchive.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl textarchive-demo -am
 *
 * # Run with default configuration
 * java -jar textarchive-demo/target/textarchive-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI archive directory override
 * java -jar textarchive-demo/target/textarchive-demo-1.0-SNAPSHOT.jar /path/to/archive
 * </pre>
 *
 * @see ArchiveConfig
 */
public class RecoveryDemo {

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|        Text Archive Recovery Demo     |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        ArchiveConfig config = args.length > 0 && !args[0].isBlank()
                ? ArchiveConfig.builder().archiveDir(args[0]).build()
                : ArchiveConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:textarchive-demo;DB_CLOSE_DELAY=-1");

        // Schema first
        MigrationManager migrations = new MigrationManager(dataSource, MigrationCatalog.fromClasspath(), config);
        MigrationStatus status = migrations.migrateOnStartup();
        System.out.println("[OK] Migrations: " + status.decision() + " (" + status.message() + ")");
        if (status.decision() == StartupDecision.BLOCKED) {
            System.out.println("[FAIL] Schema needs maintenance; stopping");
            return;
        }

        JdbcCanonicalStore store = new JdbcCanonicalStore(dataSource);
        ArchiveReader reader = new ArchiveReader(config);
        ConsistencyValidator validator = new ConsistencyValidator(reader, store);
        ArchiveWriter writer = new ArchiveWriter(config);
        ArchiveFirstService service = new ArchiveFirstService(config, writer, store, Clock.systemDefaultZone());

        try (RecoveryOrchestrator orchestrator = new RecoveryOrchestrator(config, reader, store, validator)) {
            // Bring back what earlier runs archived
            RecoveryReport bootstrap = orchestrator.recoverAll();
            System.out.println("[OK] Bootstrap recovery: " + bootstrap.totalInserted() + " rows from "
                    + config.archiveDir().toAbsolutePath());

            // Normal archive-first writes
            registerIfAbsent(service, store, "alice", null);
            registerIfAbsent(service, store, "bob", "alice");
            service.ensureDefaultRoles();
            service.recordRoleAssignment("alice", "admin", "granted", "system", null, "first user");
            CanonicalRecord prayer = service.submitPrayer("alice",
                    "Please pray for my mother's recovery.", null, "healing", "community");
            service.recordPrayerActivity(prayer.entityId(), "bob", "prayed", null);
            service.recordPrayerActivity(prayer.entityId(), "alice", "testimony", "She is home again.");
            service.recordAuthRequest("bob", "Firefox on Linux", "192.0.2.10", "pending", "new device");
            service.snapshotSessions(List.of(new ArchiveFirstService.Session("s-" + prayer.entityId(), "alice",
                    LocalDateTime.now(), LocalDateTime.now().plusDays(14), "Safari", "192.0.2.20", true)));
            System.out.println("[OK] Prayer " + prayer.entityId() + " archived at " + prayer.archivePath());

            StoreSnapshot before = validator.snapshot();
            print("Store before wipe", before);

            // Simulate losing the database
            List<EntityType> childrenFirst = new ArrayList<>(RecoveryPlan.order());
            Collections.reverse(childrenFirst);
            for (EntityType type : childrenFirst) {
                store.deleteAll(type);
            }
            System.out.println("\n[OK] Store wiped: " + validator.snapshot().total() + " rows left");

            RecoveryReport report = orchestrator.recoverAll();
            StoreSnapshot after = validator.snapshot();
            print("Store after recovery", after);

            System.out.println();
            System.out.println("[" + (before.equals(after) ? "OK" : "FAIL") + "] Row counts "
                    + (before.equals(after) ? "match" : "differ"));
            System.out.println("[" + (report.isConsistent() ? "OK" : "WARN") + "] Archive and store "
                    + (report.isConsistent() ? "consistent" : "diverge"));
            if (!report.unparsed().isEmpty()) {
                System.out.println("[WARN] " + report.unparsed().size() + " archive lines could not be parsed");
            }
        }

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  Recovery demo complete!              |");
        System.out.println("|  Run again to see rows recovered.     |");
        System.out.println("+---------------------------------------+");
    }

    private static void registerIfAbsent(ArchiveFirstService service, JdbcCanonicalStore store,
                                         String userName, String invitedBy) {
        if (store.find(NaturalKey.entity(EntityType.USER, userName)).isEmpty()) {
            service.registerUser(userName, invitedBy);
        }
    }

    private static void print(String title, StoreSnapshot snapshot) {
        System.out.println("\n  " + title + ":");
        snapshot.counts().forEach((type, count) -> {
            if (count > 0) {
                System.out.printf("    %-22s %d%n", type, count);
            }
        });
    }
}
