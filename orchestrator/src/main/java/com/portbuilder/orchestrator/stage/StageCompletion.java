package com.portbuilder.orchestrator.stage;

import com.portbuilder.orchestrator.model.Port;
import com.portbuilder.orchestrator.model.StageName;

/** Payload of {@link StageMachine#STAGE_COMPLETED}. */
public record StageCompletion(Port port, StageName stage, boolean success, int exitCode) {}
