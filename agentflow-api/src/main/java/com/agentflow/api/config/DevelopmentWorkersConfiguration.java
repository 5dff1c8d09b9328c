package com.agentflow.api.config;

import com.agentflow.core.repository.WorkerRegistry;
import com.agentflow.examples.development.DevelopmentWorkers;
import com.agentflow.worker.invoker.LocalWorkerInvoker;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the built-in development workers and binds their in-process implementations.
 * The matching workflows come from {@code workflows/development-workflows.yml}.
 */
@Configuration
@ConditionalOnProperty(prefix = "agentflow.examples", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DevelopmentWorkersConfiguration {

    @Bean
    public InitializingBean developmentWorkerRegistration(WorkerRegistry workerRegistry,
                                                          LocalWorkerInvoker localWorkerInvoker) {
        return () -> DevelopmentWorkers.register(workerRegistry, localWorkerInvoker);
    }
}
