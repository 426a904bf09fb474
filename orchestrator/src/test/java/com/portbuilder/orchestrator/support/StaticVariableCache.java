package com.portbuilder.orchestrator.support;

import com.portbuilder.orchestrator.attr.BuildVariableCache;
import com.portbuilder.orchestrator.model.DependencyType;
import com.portbuilder.orchestrator.model.PortAttributes;
import com.portbuilder.orchestrator.queue.JobResult;
import com.portbuilder.orchestrator.queue.JobSpec;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A ports tree held in memory. Origins that were never added fail to load,
 * like a directory missing from the tree.
 */
public class StaticVariableCache implements BuildVariableCache {

    private final Map<String, PortAttributes> tree   = new HashMap<>();
    private final Map<String, PortAttributes> loaded = new HashMap<>();

    /** Adds a port whose build dependencies are the given origins. */
    public StaticVariableCache add(String origin, String pkgname, String... buildDepends) {
        Map<DependencyType, List<String>> depends = new EnumMap<>(DependencyType.class);
        depends.put(DependencyType.BUILD, List.of(buildDepends));
        return add(origin, attributes(pkgname, depends));
    }

    public StaticVariableCache add(String origin, PortAttributes attrs) {
        tree.put(origin, attrs);
        return this;
    }

    public static PortAttributes attributes(String pkgname, Map<DependencyType, List<String>> depends) {
        return new PortAttributes(pkgname, depends, List.of(), "/usr/ports/distfiles",
                "distinfo", "/usr/ports/packages/All/" + pkgname + ".pkg", false);
    }

    @Override
    public Optional<PortAttributes> cached(String origin) {
        return Optional.ofNullable(loaded.get(origin));
    }

    @Override
    public JobSpec query(String jobId, String origin) {
        return JobSpec.query(jobId, List.of("make", "-V", "PKGNAME"));
    }

    @Override
    public Optional<PortAttributes> parse(String origin, JobResult result) {
        PortAttributes attrs = tree.get(origin);
        if (!result.success() || attrs == null) {
            return Optional.empty();
        }
        loaded.put(origin, attrs);
        return Optional.of(attrs);
    }
}
