package com.portbuilder.orchestrator.pkg;

import com.portbuilder.orchestrator.PortbuilderException;
import com.portbuilder.orchestrator.config.BuildPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the installed package list with {@code pkg info -aoQ}.
 *
 * Runs once at startup, before the event loop, so it may block.
 */
public class PkgInfoReader {

    private static final Logger log = LoggerFactory.getLogger(PkgInfoReader.class);

    private final BuildPolicy policy;

    public PkgInfoReader(BuildPolicy policy) {
        this.policy = policy;
    }

    public List<String> command() {
        List<String> args = new ArrayList<>();
        if (!policy.chroot().isEmpty()) {
            args.add("chroot");
            args.add(policy.chroot());
        }
        args.addAll(List.of("pkg", "info", "-aoQ"));
        return args;
    }

    /**
     * @return {@code pkgname:origin} lines, or an empty list if pkg reports an error
     *         (e.g. no package database yet)
     * @throws PortbuilderException if pkg cannot be run at all
     */
    public List<String> read() {
        List<String> command = command();
        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            process.getOutputStream().close();
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            int exit = process.waitFor();
            if (exit != 0) {
                log.warn("'{}' exited with {}; assuming no packages are installed", String.join(" ", command), exit);
                return List.of();
            }
            return output.lines().toList();
        } catch (IOException e) {
            throw new PortbuilderException(PortbuilderException.Kind.INVALID_CONFIG,
                    "Cannot run " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PortbuilderException(PortbuilderException.Kind.ILLEGAL_STATE,
                    "Interrupted while reading the package database", e);
        }
    }
}
