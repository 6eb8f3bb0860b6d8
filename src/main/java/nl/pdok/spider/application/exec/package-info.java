/**
 * Execution primitives for network-bound batches: the bounded fetch orchestrator and the retry policy.
 * <p><strong>Concurrency:</strong> {@link nl.pdok.spider.application.exec.FetchOrchestrator} owns its worker
 * threads; results are only published after the completion barrier.</p>
 *
 * @since 0.1.0
 */
package nl.pdok.spider.application.exec;
