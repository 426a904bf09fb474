package com.portbuilder.orchestrator.stage;

import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.model.PortAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * What is known about distribution files across all ports of the run.
 *
 * Several ports often share a distfile, so a CHECKSUM or FETCH job only
 * starts once no other job of the same kind holds any of its files, and a
 * file fetched (or found broken) once is not examined again.
 */
@Component
public class DistfileTracker {

    private static final Logger log = LoggerFactory.getLogger(DistfileTracker.class);

    private final BuildPolicy policy;

    private final Set<String> fetched     = new HashSet<>();
    private final Set<String> badChecksum = new HashSet<>();
    private final Set<String> fetchFailed = new HashSet<>();

    private final FileLock checksumLock = new FileLock();
    private final FileLock fetchLock    = new FileLock();

    public DistfileTracker(BuildPolicy policy) {
        this.policy = policy;
    }

    // ------------------------------------------------------------------
    // Completion checks
    // ------------------------------------------------------------------

    /**
     * True if checksumming would tell us nothing new: the files were already
     * verified, one is known bad or missing (FETCH will deal with it), or
     * this is a no-op run.
     */
    public boolean checksumComplete(PortAttributes attrs) {
        if (policy.noOp() || fetched.containsAll(attrs.distfiles())) {
            return true;
        }
        for (String file : attrs.distfiles()) {
            if (badChecksum.contains(file)) {
                return true;
            }
        }
        Path distdir = policy.hostPath(attrs.distdir());
        for (String file : attrs.distfiles()) {
            if (!Files.isRegularFile(distdir.resolve(file))) {
                log.debug("Distfile {} missing from {}", file, distdir);
                badChecksum.add(file);
                return true;
            }
        }
        return false;
    }

    public boolean fetchComplete(PortAttributes attrs) {
        return fetched.containsAll(attrs.distfiles());
    }

    /** True if every distfile of the port already failed to fetch. */
    public boolean fetchImpossible(PortAttributes attrs) {
        return !attrs.distfiles().isEmpty() && fetchFailed.containsAll(attrs.distfiles());
    }

    // ------------------------------------------------------------------
    // Locks
    // ------------------------------------------------------------------

    public boolean lockChecksum(Collection<String> files) { return checksumLock.acquire(files); }
    public void    releaseChecksum(Collection<String> files) { checksumLock.release(files); }
    public boolean lockFetch(Collection<String> files)    { return fetchLock.acquire(files); }
    public void    releaseFetch(Collection<String> files)    { fetchLock.release(files); }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    public void checksumFinished(Collection<String> files, boolean ok) {
        if (ok) {
            fetched.addAll(files);
        } else {
            badChecksum.addAll(files);
        }
    }

    public void fetchFinished(Collection<String> files, boolean ok) {
        if (ok) {
            badChecksum.removeAll(files);
            fetched.addAll(files);
        } else {
            log.warn("Failed to fetch distfiles {}", files);
            badChecksum.addAll(files);
            fetchFailed.addAll(files);
        }
    }

    /** Excludes two jobs from working on the same files at once. */
    static final class FileLock {

        private final Set<String> held = new HashSet<>();

        boolean acquire(Collection<String> files) {
            for (String file : files) {
                if (held.contains(file)) {
                    return false;
                }
            }
            held.addAll(files);
            return true;
        }

        void release(Collection<String> files) {
            if (!held.containsAll(files)) {
                throw new IllegalStateException("Releasing distfiles that are not locked: " + files);
            }
            held.removeAll(files);
        }
    }
}
