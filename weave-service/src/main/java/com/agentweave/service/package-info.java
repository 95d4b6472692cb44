/**
 * Caller-facing service: pattern registry, workflow submission (synchronous and
 * asynchronous), cancellation, status tracking and result retention.
 */
package com.agentweave.service;
