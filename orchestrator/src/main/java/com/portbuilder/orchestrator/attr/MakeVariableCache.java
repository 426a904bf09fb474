package com.portbuilder.orchestrator.attr;

import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.model.DependencyType;
import com.portbuilder.orchestrator.model.PortAttributes;
import com.portbuilder.orchestrator.queue.JobResult;
import com.portbuilder.orchestrator.queue.JobSpec;
import com.portbuilder.orchestrator.stage.MakeCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads port metadata with {@code make -V}, one variable per output line.
 *
 * Dependency variables hold {@code object:path[:target]} tuples where path
 * is the dependency's directory under the ports tree, e.g.
 * <pre>
 *   libcurl.so:/usr/ports/ftp/curl  gmake:/usr/ports/devel/gmake:patch
 * </pre>
 */
public class MakeVariableCache implements BuildVariableCache {

    private static final Logger log = LoggerFactory.getLogger(MakeVariableCache.class);

    private static final Map<String, DependencyType> DEPEND_VARIABLES = new LinkedHashMap<>();

    static {
        DEPEND_VARIABLES.put("BUILD_DEPENDS",   DependencyType.BUILD);
        DEPEND_VARIABLES.put("EXTRACT_DEPENDS", DependencyType.EXTRACT);
        DEPEND_VARIABLES.put("FETCH_DEPENDS",   DependencyType.FETCH);
        DEPEND_VARIABLES.put("LIB_DEPENDS",     DependencyType.LIB);
        DEPEND_VARIABLES.put("RUN_DEPENDS",     DependencyType.RUN);
        DEPEND_VARIABLES.put("PATCH_DEPENDS",   DependencyType.PATCH);
        DEPEND_VARIABLES.put("PKG_DEPENDS",     DependencyType.PKG);
    }

    static final List<String> VARIABLES;

    static {
        List<String> variables = new ArrayList<>();
        variables.add("PKGNAME");
        variables.addAll(DEPEND_VARIABLES.keySet());
        variables.addAll(List.of("DISTFILES", "_DISTDIR", "DISTINFO_FILE", "PKGFILE", "NO_PACKAGE"));
        VARIABLES = List.copyOf(variables);
    }

    private final BuildPolicy  policy;
    private final MakeCommands commands;

    private final Map<String, PortAttributes> cache = new HashMap<>();

    public MakeVariableCache(BuildPolicy policy, MakeCommands commands) {
        this.policy   = policy;
        this.commands = commands;
    }

    @Override
    public Optional<PortAttributes> cached(String origin) {
        return Optional.ofNullable(cache.get(origin));
    }

    @Override
    public JobSpec query(String jobId, String origin) {
        List<String> args = new ArrayList<>();
        for (String variable : VARIABLES) {
            args.add("-V");
            args.add(variable);
        }
        return JobSpec.query(jobId, commands.make(origin, List.of(), args));
    }

    @Override
    public Optional<PortAttributes> parse(String origin, JobResult result) {
        PortAttributes known = cache.get(origin);
        if (known != null) {
            return Optional.of(known);
        }
        if (!result.success()) {
            log.error("Port '{}': reading make variables failed (exit code {}): {}",
                    origin, result.exitCode(), result.output().strip());
            return Optional.empty();
        }

        List<String> lines = result.output().lines().toList();
        if (lines.size() < VARIABLES.size()) {
            log.error("Port '{}': expected {} make variables, got {} lines",
                    origin, VARIABLES.size(), lines.size());
            return Optional.empty();
        }
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < VARIABLES.size(); i++) {
            values.put(VARIABLES.get(i), lines.get(i).strip());
        }

        PortAttributes attrs;
        try {
            attrs = toAttributes(values);
        } catch (IllegalArgumentException e) {
            log.error("Port '{}': {}", origin, e.getMessage());
            return Optional.empty();
        }
        cache.put(origin, attrs);
        log.debug("Port '{}': loaded metadata for {}", origin, attrs.pkgname());
        return Optional.of(attrs);
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    private PortAttributes toAttributes(Map<String, String> values) {
        String pkgname = values.get("PKGNAME");
        if (pkgname.isEmpty()) {
            throw new IllegalArgumentException("PKGNAME is empty");
        }

        Map<DependencyType, List<String>> depends = new EnumMap<>(DependencyType.class);
        DEPEND_VARIABLES.forEach((variable, type) ->
                depends.put(type, parseDepends(variable, values.get(variable))));

        List<String> distfiles = new ArrayList<>();
        for (String token : words(values.get("DISTFILES"))) {
            int group = token.lastIndexOf(':');
            distfiles.add(group < 0 ? token : token.substring(0, group));
        }

        return new PortAttributes(
                pkgname,
                depends,
                distfiles,
                values.get("_DISTDIR"),
                values.get("DISTINFO_FILE"),
                values.get("PKGFILE"),
                !values.get("NO_PACKAGE").isEmpty());
    }

    /** Turns dependency tuples into origins, dropping duplicates. */
    private List<String> parseDepends(String variable, String value) {
        String prefix = policy.portsDir().toString() + "/";
        List<String> origins = new ArrayList<>();
        for (String token : words(value)) {
            String[] fields = token.split(":", 3);
            if (fields.length < 2 || !fields[1].startsWith(prefix)) {
                throw new IllegalArgumentException(
                        "cannot parse " + variable + " entry '" + token + "'");
            }
            String origin = stripSlashes(fields[1].substring(prefix.length()));
            if (origin.isEmpty()) {
                throw new IllegalArgumentException(
                        variable + " entry '" + token + "' names the ports tree itself");
            }
            if (!origins.contains(origin)) {
                origins.add(origin);
            }
        }
        return origins;
    }

    private static String stripSlashes(String path) {
        String result = path;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static List<String> words(String value) {
        return value.isBlank() ? List.of() : List.of(value.trim().split("\\s+"));
    }
}
