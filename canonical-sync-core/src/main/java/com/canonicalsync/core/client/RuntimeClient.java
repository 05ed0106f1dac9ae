package com.canonicalsync.core.client;

import com.canonicalsync.core.model.Environment;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the workflow-automation runtime of an environment.
 * Implementations throw UpstreamUnavailableException when the runtime cannot be reached.
 */
public interface RuntimeClient {

    /**
     * List every workflow in the environment's runtime, in the runtime's listing order.
     */
    List<WorkflowSummary> listWorkflowSummaries(Environment environment);

    /**
     * Fetch the full payload of one workflow.
     */
    JsonNode fetchWorkflow(Environment environment, String workflowId);

    /**
     * Listing entry: runtime instance id and its last modification time as reported by the runtime.
     */
    record WorkflowSummary(String id, Instant updatedAt) {}
}
