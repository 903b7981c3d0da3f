package com.cellbroker.config;

import com.cellbroker.handler.pool.SyncPool;
import com.cellbroker.model.TargetsConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Picks up new snapshots written by the control plane.
 *
 * FLOW (every reload-interval):
 *   read targets-file → same bytes as the cache? → nothing to do
 *                     → decode → store in TargetsCache → signal every sync pool
 *
 * A missing or malformed file keeps the current snapshot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TargetsConfigLoader {

    private final BrokerProperties properties;
    private final TargetsCache targetsCache;
    private final ObjectProvider<SyncPool<?>> syncPools;

    @Scheduled(fixedDelayString = "${cellbroker.reload-interval:PT2S}")
    public void reload() {
        String file = properties.getTargetsFile();
        if (file == null || file.isBlank()) {
            return;
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(Path.of(file));
        } catch (NoSuchFileException e) {
            log.debug("Targets file does not exist yet: {}", file);
            return;
        } catch (IOException e) {
            log.error("Failed to read targets file {}: {}", file, e.getMessage());
            return;
        }
        apply(bytes);
    }

    /**
     * Stores the encoded snapshot if it differs from the current one.
     *
     * @return whether a new snapshot was stored
     */
    public boolean apply(byte[] bytes) {
        if (targetsCache.equalsBytes(bytes)) {
            return false;
        }
        TargetsConfig snapshot;
        try {
            snapshot = TargetsConfigCodec.fromBytes(bytes);
        } catch (IOException | RuntimeException e) {
            log.error("Ignoring malformed targets snapshot ({} bytes): {}", bytes.length, e.getMessage());
            return false;
        }
        targetsCache.store(snapshot);
        int tenants = snapshot.getCellTenants() == null ? 0 : snapshot.getCellTenants().size();
        log.info("Loaded new targets snapshot: tenants={}", tenants);
        syncPools.orderedStream().forEach(SyncPool::signal);
        return true;
    }
}
