package com.portbuilder.orchestrator.model;

import com.portbuilder.orchestrator.model.DependencyEntry.ResolvedPort;
import com.portbuilder.orchestrator.model.DependencyEntry.UnresolvedName;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The ports a port requires, keyed by dependency type.
 *
 * {@link #failed()} is derived on every call: an unresolved name or a
 * dependency whose dependent status is FAILED makes the whole relation fail.
 */
public class Dependency {

    private final Map<DependencyType, List<DependencyEntry>> entries = new EnumMap<>(DependencyType.class);

    private ResolutionStatus status = ResolutionStatus.UNRESOLVED;
    private int              awaiting;

    /**
     * Starts resolution of {@code declared} entries. With nothing declared
     * the relation is resolved immediately.
     */
    public void startResolving(int declared) {
        if (status != ResolutionStatus.UNRESOLVED) {
            throw new IllegalStateException("Dependency relation already " + status);
        }
        awaiting = declared;
        status = declared == 0 ? ResolutionStatus.RESOLVED : ResolutionStatus.RESOLVING;
    }

    /**
     * Records one declared entry. Duplicates (same entry, same type) are
     * counted towards resolution but stored once.
     *
     * @return true if the entry was new
     */
    public boolean add(DependencyType type, DependencyEntry entry) {
        if (status != ResolutionStatus.RESOLVING) {
            throw new IllegalStateException("Dependency relation is " + status + ", not RESOLVING");
        }
        List<DependencyEntry> list = entries.computeIfAbsent(type, t -> new ArrayList<>());
        boolean added = !list.contains(entry);
        if (added) {
            list.add(entry);
        }
        if (--awaiting == 0) {
            status = ResolutionStatus.RESOLVED;
        }
        return added;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public ResolutionStatus getStatus() { return status; }

    public List<DependencyEntry> entries(DependencyType type) {
        return List.copyOf(entries.getOrDefault(type, List.of()));
    }

    public List<DependencyEntry> entries() {
        List<DependencyEntry> all = new ArrayList<>();
        entries.values().forEach(all::addAll);
        return all;
    }

    /** Distinct resolved ports, in type then insertion order. */
    public Set<Port> ports() {
        Set<Port> ports = new LinkedHashSet<>();
        for (DependencyEntry entry : entries()) {
            if (entry instanceof ResolvedPort resolved) {
                ports.add(resolved.port());
            }
        }
        return ports;
    }

    public List<String> unresolvedNames() {
        return entries().stream()
                .filter(e -> e instanceof UnresolvedName)
                .map(DependencyEntry::origin)
                .distinct()
                .toList();
    }

    public boolean failed() {
        for (DependencyEntry entry : entries()) {
            if (entry instanceof UnresolvedName) {
                return true;
            }
            if (entry instanceof ResolvedPort resolved
                    && resolved.port().getDependent().getStatus() == DependentStatus.FAILED) {
                return true;
            }
        }
        return false;
    }
}
