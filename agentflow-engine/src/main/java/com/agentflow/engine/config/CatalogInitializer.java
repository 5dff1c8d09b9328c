package com.agentflow.engine.config;

import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.model.WorkflowDefinition;
import com.agentflow.core.repository.WorkerRegistry;
import com.agentflow.engine.definition.CatalogLoader;
import com.agentflow.engine.definition.WorkflowCatalog;
import com.agentflow.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the configured YAML catalogs at startup.
 * Workers are registered first (replacing same-id registrations) so that workflows can be
 * validated against them; a malformed catalog stops the application.
 */
public class CatalogInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CatalogInitializer.class);

    private final CatalogLoader catalogLoader;
    private final WorkerRegistry workerRegistry;
    private final WorkflowService workflowService;
    private final List<String> locations;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    public CatalogInitializer(
            CatalogLoader catalogLoader,
            WorkerRegistry workerRegistry,
            WorkflowService workflowService,
            List<String> locations) {
        this.catalogLoader = catalogLoader;
        this.workerRegistry = workerRegistry;
        this.workflowService = workflowService;
        this.locations = locations;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        for (String location : locations) {
            Resource[] resources = resolver.getResources(location);
            if (resources.length == 0) {
                log.info("No catalogs found at {}", location);
            }
            for (Resource resource : resources) {
                load(resource);
            }
        }
    }

    private void load(Resource resource) throws IOException {
        String source = resource.getDescription();
        WorkflowCatalog catalog;
        try (InputStream input = resource.getInputStream()) {
            catalog = catalogLoader.load(input, source);
        }
        for (WorkerDescriptor worker : catalog.workers()) {
            workerRegistry.register(worker, true);
        }
        for (WorkflowDefinition workflow : catalog.workflows()) {
            workflowService.registerWorkflow(workflow);
        }
    }
}
