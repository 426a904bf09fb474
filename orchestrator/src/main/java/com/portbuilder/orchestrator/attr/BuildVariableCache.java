package com.portbuilder.orchestrator.attr;

import com.portbuilder.orchestrator.model.PortAttributes;
import com.portbuilder.orchestrator.queue.JobResult;
import com.portbuilder.orchestrator.queue.JobSpec;

import java.util.Optional;

/**
 * Source of port metadata.
 *
 * The query itself runs as a job on the ATTR queue; this interface only
 * describes the job and interprets its output. Results are remembered per
 * origin so a port is never queried twice in one run.
 */
public interface BuildVariableCache {

    /** Attributes already obtained for the origin, if any. */
    Optional<PortAttributes> cached(String origin);

    /** The job, under the given id, that asks the ports tree for the origin's variables. */
    JobSpec query(String jobId, String origin);

    /**
     * Interprets a finished query and caches the result.
     *
     * @return empty if the job failed or its output could not be understood
     */
    Optional<PortAttributes> parse(String origin, JobResult result);
}
