/**
 * Workflow data model shared by the engine, the patterns and the service: subtasks,
 * agent and workflow results, progress events, the dependency graph, configuration and the
 * error taxonomy. No execution logic lives here.
 */
package com.agentweave.workflow;
