package com.portbuilder.orchestrator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Build metadata of a port, as reported by the build-variable cache.
 *
 * @param pkgname   package name including version, e.g. {@code curl-8.4.0_1}
 * @param depends   declared dependency origins per type
 * @param distfiles distribution file names (without fetch group suffix)
 * @param distdir   distfile sub-directory, relative to the (chroot) root
 * @param distinfo  path of the distinfo file
 * @param pkgfile   path of the package file this port would produce
 * @param noPackage packaging is restricted
 */
public record PortAttributes(
        String                            pkgname,
        Map<DependencyType, List<String>> depends,
        List<String>                      distfiles,
        String                            distdir,
        String                            distinfo,
        String                            pkgfile,
        boolean                           noPackage) {

    public record Declaration(DependencyType type, String origin) {}

    public PortAttributes {
        depends   = Map.copyOf(depends);
        distfiles = List.copyOf(distfiles);
    }

    /** The package name without its version. */
    public String portName() {
        int dash = pkgname.lastIndexOf('-');
        return dash < 0 ? pkgname : pkgname.substring(0, dash);
    }

    /** Declared dependencies of the given types, in type then declaration order. */
    public List<Declaration> declared(Set<DependencyType> types) {
        List<Declaration> result = new ArrayList<>();
        for (DependencyType type : DependencyType.values()) {
            if (types.contains(type)) {
                for (String origin : depends.getOrDefault(type, List.of())) {
                    result.add(new Declaration(type, origin));
                }
            }
        }
        return result;
    }
}
