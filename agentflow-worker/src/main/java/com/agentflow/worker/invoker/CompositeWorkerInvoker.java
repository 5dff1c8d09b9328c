package com.agentflow.worker.invoker;

import com.agentflow.core.exception.WorkerInvocationException;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.worker.WorkerContext;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerResult;

import java.util.List;

/**
 * Delegates to the first invoker that supports a worker, in the given order.
 */
public class CompositeWorkerInvoker implements WorkerInvoker {

    private final List<WorkerInvoker> delegates;

    public CompositeWorkerInvoker(List<WorkerInvoker> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean supports(WorkerDescriptor descriptor) {
        return delegates.stream().anyMatch(d -> d.supports(descriptor));
    }

    @Override
    public WorkerResult invoke(WorkerDescriptor descriptor, WorkerContext context) throws WorkerException {
        for (WorkerInvoker delegate : delegates) {
            if (delegate.supports(descriptor)) {
                return delegate.invoke(descriptor, context);
            }
        }
        throw new WorkerInvocationException(descriptor.id(), "No invoker can reach this worker");
    }
}
