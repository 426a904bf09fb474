package com.portbuilder.orchestrator.graph;

import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.model.Port;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.util.Optional;

/**
 * Picks how a dependency gets installed: the first configured method that
 * can work for the port.
 *
 * PACKAGE needs the port's package file to exist already; BUILD and REPO
 * are always worth a try.
 */
@Component
public class DependMethodSelector {

    private static final Logger log = LoggerFactory.getLogger(DependMethodSelector.class);

    private final BuildPolicy policy;

    public DependMethodSelector(BuildPolicy policy) {
        this.policy = policy;
    }

    public Optional<DependMethod> select(Port port) {
        for (DependMethod method : policy.methods()) {
            if (applicable(port, method)) {
                return Optional.of(method);
            }
            log.debug("Port '{}': method {} not applicable", port, method);
        }
        return Optional.empty();
    }

    boolean applicable(Port port, DependMethod method) {
        return switch (method) {
            case BUILD, REPO -> true;
            case PACKAGE -> {
                String pkgfile = port.getAttributes().pkgfile();
                yield pkgfile != null && !pkgfile.isEmpty()
                        && Files.isRegularFile(policy.hostPath(pkgfile));
            }
        };
    }
}
