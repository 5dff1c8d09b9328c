package com.agentflow.worker.invoker;

import com.agentflow.core.exception.WorkerInvocationException;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.worker.Worker;
import com.agentflow.worker.WorkerContext;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Invokes in-process worker implementations bound by worker id.
 */
public class LocalWorkerInvoker implements WorkerInvoker {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerInvoker.class);

    private final Map<String, Worker> bindings = new ConcurrentHashMap<>();

    /**
     * Bind an implementation to a worker id, replacing any previous binding.
     */
    public LocalWorkerInvoker bind(String workerId, Worker worker) {
        Worker previous = bindings.put(workerId, worker);
        if (previous != null) {
            log.info("Replaced local binding for worker {}", workerId);
        } else {
            log.debug("Bound local worker {}", workerId);
        }
        return this;
    }

    public Set<String> boundWorkerIds() {
        return Set.copyOf(bindings.keySet());
    }

    @Override
    public boolean supports(WorkerDescriptor descriptor) {
        return bindings.containsKey(descriptor.id());
    }

    @Override
    public WorkerResult invoke(WorkerDescriptor descriptor, WorkerContext context) throws WorkerException {
        Worker worker = bindings.get(descriptor.id());
        if (worker == null) {
            throw new WorkerInvocationException(descriptor.id(), "No local implementation bound");
        }
        WorkerResult result = worker.invoke(context);
        if (result == null) {
            throw new WorkerInvocationException(descriptor.id(), "Worker returned no result");
        }
        return result;
    }
}
