/**
 * Progress delivery: the fail-safe per-run {@link com.agentweave.progress.EventEmitter} and
 * the bounded {@link com.agentweave.progress.ProgressChannel} that decouples a run from a
 * slow subscriber.
 */
package com.agentweave.progress;
