package com.portbuilder.orchestrator.stage;

import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.model.InstallStatus;
import com.portbuilder.orchestrator.model.Port;
import com.portbuilder.orchestrator.model.PortAttributes;
import com.portbuilder.orchestrator.model.PortFlag;
import com.portbuilder.orchestrator.model.StageName;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the argv lists for stage jobs.
 *
 * Every command is prefixed with {@code chroot <dir>} when the run uses a
 * chroot. make(1) is always invoked on the port directory with the targets
 * first and variables after them:
 * <pre>
 *   make -C /usr/ports/www/curl all -DBATCH -DNO_DEPENDS
 * </pre>
 */
@Component
public class MakeCommands {

    private static final Path DEFAULT_PORTSDIR = Path.of("/usr/ports");

    private final BuildPolicy policy;

    public MakeCommands(BuildPolicy policy) {
        this.policy = policy;
    }

    public List<String> make(String origin, List<String> targets, List<String> args) {
        List<String> argv = new ArrayList<>();
        argv.add("make");
        argv.add("-C");
        argv.add(policy.portsDir().resolve(origin).toString());
        argv.addAll(targets);
        argv.addAll(args);
        if (!policy.portsDir().equals(DEFAULT_PORTSDIR)) {
            argv.add("PORTSDIR=" + policy.portsDir());
        }
        return inRoot(argv);
    }

    /** Commands for one stage of one port, run in order. */
    public List<List<String>> forStage(Port port, StageName stage) {
        String origin = port.getOrigin();
        return switch (stage) {
            case CHECKSUM -> List.of(make(origin, List.of("checksum"),
                    List.of("-DBATCH", "-DNO_DEPENDS", "-DDISABLE_CONFLICTS", "FETCH_REGET=0")));
            case FETCH -> List.of(make(origin, List.of("checksum"),
                    List.of("-DBATCH", "-DDISABLE_CONFLICTS", "-DNO_DEPENDS")));
            case BUILD -> List.of(make(origin, List.of("all"),
                    List.of("-DBATCH", "-DNO_DEPENDS")));
            case INSTALL -> install(port);
            case PACKAGE -> List.of(make(origin, List.of("package"),
                    List.of("-DBATCH", "-DNO_DEPENDS")));
            case CLEAN -> List.of(make(origin, List.of("clean"),
                    List.of("-DNOCLEANDEPENDS")));
            case DEPEND -> throw new IllegalArgumentException("DEPEND runs a metadata query, not a make target");
        };
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<List<String>> install(Port port) {
        PortAttributes attrs   = port.getAttributes();
        boolean        present = port.getInstallStatus() != InstallStatus.ABSENT;
        DependMethod   method  = port.getMethod() != null ? port.getMethod() : DependMethod.BUILD;

        return switch (method) {
            case BUILD -> {
                List<String> targets = present ? List.of("deinstall", "reinstall") : List.of("install");
                List<String> args = new ArrayList<>(List.of("-DBATCH", "-DNO_DEPENDS"));
                if (!port.hasFlag(PortFlag.EXPLICIT)) {
                    args.add("-DINSTALLS_DEPENDS");
                }
                yield List.of(make(port.getOrigin(), targets, args));
            }
            case PACKAGE -> {
                List<List<String>> commands = new ArrayList<>();
                if (present) {
                    commands.add(inRoot(List.of("pkg", "delete", "-fy", attrs.portName())));
                }
                commands.add(inRoot(List.of("pkg", "add", attrs.pkgfile())));
                yield commands;
            }
            case REPO -> List.of(inRoot(List.of("pkg", "install", "-y", attrs.pkgname())));
        };
    }

    private List<String> inRoot(List<String> command) {
        if (policy.chroot().isEmpty()) {
            return command;
        }
        List<String> argv = new ArrayList<>(List.of("chroot", policy.chroot()));
        argv.addAll(command);
        return argv;
    }
}
