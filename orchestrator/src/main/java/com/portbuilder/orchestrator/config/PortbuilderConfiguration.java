package com.portbuilder.orchestrator.config;

import com.portbuilder.orchestrator.PortbuilderException;
import com.portbuilder.orchestrator.attr.BuildVariableCache;
import com.portbuilder.orchestrator.attr.MakeVariableCache;
import com.portbuilder.orchestrator.event.JvmSignalSource;
import com.portbuilder.orchestrator.event.SignalSource;
import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.pkg.PackageDatabase;
import com.portbuilder.orchestrator.pkg.PkgInfoReader;
import com.portbuilder.orchestrator.queue.DryRunJobExecutor;
import com.portbuilder.orchestrator.queue.JobExecutor;
import com.portbuilder.orchestrator.queue.ProcessJobExecutor;
import com.portbuilder.orchestrator.queue.QueueName;
import com.portbuilder.orchestrator.stage.MakeCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the run-wide {@link BuildPolicy} and the collaborators that talk to
 * the host system. Everything else is picked up by component scanning.
 *
 * Properties live under {@code portbuilder.*}; see application.yml.
 */
@Configuration
public class PortbuilderConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PortbuilderConfiguration.class);

    @Bean
    public BuildPolicy buildPolicy(
            @Value("${portbuilder.ports-dir:/usr/ports}")       String   portsDir,
            @Value("${portbuilder.chroot:}")                    String   chroot,
            @Value("${portbuilder.log-dir:/tmp/portbuilder}")   String   logDir,
            @Value("${portbuilder.methods:build}")              String[] methods,
            @Value("${portbuilder.fetch-only:false}")           boolean  fetchOnly,
            @Value("${portbuilder.no-op:false}")                boolean  noOp,
            @Value("${portbuilder.force:false}")                boolean  force,
            @Value("${portbuilder.upgrade:false}")              boolean  upgrade,
            @Value("${portbuilder.package:false}")              boolean  packageStage,
            @Value("${portbuilder.clean:true}")                 boolean  clean,
            @Value("${portbuilder.resolve-first:false}")        boolean  resolveFirst,
            @Value("${portbuilder.debug:false}")                boolean  debug,
            Environment environment) {

        BuildPolicy.Builder builder = BuildPolicy.builder()
                .portsDir(Path.of(portsDir))
                .chroot(chroot)
                .logDir(Path.of(logDir))
                .methods(parseMethods(methods))
                .fetchOnly(fetchOnly)
                .noOp(noOp)
                .force(force)
                .upgrade(upgrade)
                .packageStage(packageStage)
                .clean(clean)
                .resolveFirst(resolveFirst)
                .debug(debug);

        for (QueueName name : QueueName.values()) {
            Integer load = environment.getProperty("portbuilder.loads." + name.key(), Integer.class);
            if (load != null) {
                builder.load(name, load);
            }
        }

        BuildPolicy policy = builder.build();
        if (debug) {
            LoggingSystem.get(getClass().getClassLoader()).setLogLevel("com.portbuilder", LogLevel.DEBUG);
        }
        log.info("Build policy: portsDir={} chroot='{}' methods={} threshold={} stages={}",
                policy.portsDir(), policy.chroot(), policy.methods(), policy.threshold(), policy.pipelineStages());
        return policy;
    }

    @Bean(destroyMethod = "shutdown")
    public JobExecutor jobExecutor(BuildPolicy policy) {
        JobExecutor processes = new ProcessJobExecutor();
        if (policy.noOp()) {
            log.info("No-op run: commands that change the system are printed, not executed");
            return new DryRunJobExecutor(processes, System.out);
        }
        return processes;
    }

    @Bean
    public PackageDatabase packageDatabase(BuildPolicy policy) {
        PackageDatabase packages = new PackageDatabase();
        packages.load(new PkgInfoReader(policy).read());
        return packages;
    }

    @Bean
    public BuildVariableCache buildVariableCache(BuildPolicy policy, MakeCommands commands) {
        return new MakeVariableCache(policy, commands);
    }

    @Bean
    public SignalSource signalSource() {
        return new JvmSignalSource();
    }

    static List<DependMethod> parseMethods(String[] values) {
        List<DependMethod> methods = new ArrayList<>();
        for (String value : values) {
            if (value.isBlank()) {
                continue;
            }
            try {
                methods.add(DependMethod.fromConfig(value.trim()));
            } catch (IllegalArgumentException e) {
                throw new PortbuilderException(PortbuilderException.Kind.INVALID_CONFIG, e.getMessage(), e);
            }
        }
        return methods;
    }
}
