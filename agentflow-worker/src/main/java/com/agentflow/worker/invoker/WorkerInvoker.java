package com.agentflow.worker.invoker;

import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.worker.WorkerContext;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerResult;

/**
 * Boundary through which the orchestrator calls an external capability.
 * The capability itself stays opaque.
 */
public interface WorkerInvoker {

    /**
     * Check if this invoker can reach the described worker.
     */
    boolean supports(WorkerDescriptor descriptor);

    /**
     * Invoke the worker. Blocking; may be interrupted on cancellation.
     *
     * @throws WorkerException on a controlled worker failure
     * @throws com.agentflow.core.exception.WorkerInvocationException if the worker cannot be reached at all
     */
    WorkerResult invoke(WorkerDescriptor descriptor, WorkerContext context) throws WorkerException;
}
