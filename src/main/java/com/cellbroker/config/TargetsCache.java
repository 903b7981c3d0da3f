package com.cellbroker.config;

import com.cellbroker.model.CellTenant;
import com.cellbroker.model.CellTenantKey;
import com.cellbroker.model.Target;
import com.cellbroker.model.TargetKey;
import com.cellbroker.model.TargetsConfig;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * In-memory view of the current {@link TargetsConfig}.
 *
 * HOW IT WORKS:
 *   - One AtomicReference holds the current snapshot.
 *   - store() swaps in a complete new snapshot; nothing is ever mutated in place.
 *   - Every read does a single load() and works on that snapshot, so a reader
 *     sees either the old snapshot or the new one, never a mix.
 *
 * Values handed out by the read methods belong to the snapshot. Do not modify them.
 */
@Component
public class TargetsCache {

    private final AtomicReference<TargetsConfig> current;

    public TargetsCache() {
        this(TargetsConfig.empty());
    }

    public TargetsCache(TargetsConfig initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial snapshot"));
    }

    public void store(TargetsConfig snapshot) {
        current.set(Objects.requireNonNull(snapshot, "snapshot"));
    }

    public TargetsConfig load() {
        return current.get();
    }

    /**
     * Visits every target of every tenant until the visitor returns false.
     */
    public void forEachTarget(Predicate<Target> visitor) {
        for (CellTenant tenant : tenants(load())) {
            if (tenant.getTargets() == null) {
                continue;
            }
            for (Target target : tenant.getTargets().values()) {
                if (!visitor.test(target)) {
                    return;
                }
            }
        }
    }

    /**
     * Visits every tenant until the visitor returns false.
     */
    public void forEachCellTenant(Predicate<CellTenant> visitor) {
        for (CellTenant tenant : tenants(load())) {
            if (!visitor.test(tenant)) {
                return;
            }
        }
    }

    public Optional<CellTenant> getCellTenant(CellTenantKey key) {
        Map<String, CellTenant> tenants = load().getCellTenants();
        if (tenants == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tenants.get(key.persistenceString()));
    }

    public Optional<Target> getTarget(TargetKey key) {
        return getCellTenant(key.getParentKey())
                .map(CellTenant::getTargets)
                .map(targets -> targets.get(key.getName()));
    }

    public byte[] bytes() {
        return TargetsConfigCodec.toBytes(load());
    }

    /**
     * Text form of the snapshot for debugging. Not stable; never parse it for
     * anything but {@link #equalsDebugString(String)}.
     */
    public String debugString() {
        return TargetsConfigCodec.toText(load());
    }

    /**
     * Whether {@code other} encodes the snapshot currently loaded. Malformed
     * bytes are simply not equal.
     */
    public boolean equalsBytes(byte[] other) {
        if (other == null) {
            return false;
        }
        TargetsConfig self = load();
        if (Arrays.equals(TargetsConfigCodec.toBytes(self), other)) {
            return true;
        }
        try {
            return self.equals(TargetsConfigCodec.fromBytes(other));
        } catch (IOException | RuntimeException e) {
            return false;
        }
    }

    public boolean equalsDebugString(String other) {
        if (other == null) {
            return false;
        }
        try {
            return load().equals(TargetsConfigCodec.fromText(other));
        } catch (IOException | RuntimeException e) {
            return false;
        }
    }

    private static Iterable<CellTenant> tenants(TargetsConfig snapshot) {
        Map<String, CellTenant> tenants = snapshot.getCellTenants();
        return tenants == null ? List.of() : tenants.values();
    }
}
