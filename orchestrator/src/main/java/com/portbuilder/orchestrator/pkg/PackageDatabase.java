package com.portbuilder.orchestrator.pkg;

import com.portbuilder.orchestrator.model.InstallStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Installed packages, keyed by the origin they were built from.
 *
 * Loaded once from {@code pkg info -aoQ} output ({@code pkgname:origin}
 * lines) and kept current by the orchestrator as it installs and removes
 * packages. Only used from the event loop thread after loading.
 */
public class PackageDatabase {

    private static final Logger log = LoggerFactory.getLogger(PackageDatabase.class);

    private final Map<String, Set<String>> packages = new HashMap<>();

    /** Replaces the contents with the given {@code pkgname:origin} lines. */
    public void load(List<String> lines) {
        packages.clear();
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int colon = line.lastIndexOf(':');
            if (colon <= 0) {
                log.warn("Ignoring malformed package line '{}'", line);
                continue;
            }
            String pkgname = line.substring(0, colon).trim();
            String origin  = line.substring(colon + 1).trim();
            packages.computeIfAbsent(origin, k -> new LinkedHashSet<>()).add(pkgname);
        }
        log.info("Loaded {} installed package(s) from {} origin(s)",
                packages.values().stream().mapToInt(Set::size).sum(), packages.size());
    }

    /**
     * Install status of the port at {@code origin} that builds {@code pkgname}.
     * Packages from the same origin but with a different name (e.g. a flavour)
     * only count as OLDER.
     */
    public InstallStatus status(String origin, String pkgname) {
        Set<String> installed = packages.get(origin);
        if (installed == null || installed.isEmpty()) {
            return InstallStatus.ABSENT;
        }
        InstallStatus status = InstallStatus.OLDER;
        String name = PackageVersions.name(pkgname);
        for (String candidate : installed) {
            if (PackageVersions.name(candidate).equals(name)) {
                InstallStatus compared = PackageVersions.compare(candidate, pkgname);
                if (compared.isAbove(status)) {
                    status = compared;
                }
            }
        }
        return status;
    }

    public Set<String> installed(String origin) {
        return Set.copyOf(packages.getOrDefault(origin, Set.of()));
    }

    public void recordInstalled(String origin, String pkgname) {
        recordRemoved(origin, pkgname);
        packages.computeIfAbsent(origin, k -> new LinkedHashSet<>()).add(pkgname);
    }

    /** Forgets every package from {@code origin} with the same name as {@code pkgname}. */
    public void recordRemoved(String origin, String pkgname) {
        Set<String> installed = packages.get(origin);
        if (installed != null) {
            String name = PackageVersions.name(pkgname);
            installed.removeIf(p -> PackageVersions.name(p).equals(name));
        }
    }
}
