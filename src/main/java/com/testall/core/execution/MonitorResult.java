package com.testall.core.execution;

import com.testall.core.model.RunOutcome;

import java.util.List;

/**
 * What the monitor observed: the outcome, the execution that triggered a failure
 * (null unless {@link RunOutcome#FAILURE}), and every execution in its final state.
 */
public record MonitorResult(
    RunOutcome outcome,
    Execution trigger,
    List<Execution> executions
) {}
