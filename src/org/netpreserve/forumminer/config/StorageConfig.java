package org.netpreserve.forumminer.config;

import java.nio.file.Path;

/**
 * Storage configuration.
 *
 * @param outputDir      root of the per-thread output folders
 * @param stateFile      crawl state ledger
 * @param legacyManifest flat list of visited URLs migrated into the ledger on first run
 */
public record StorageConfig(
        Path outputDir,
        Path stateFile,
        Path legacyManifest
) {
}
