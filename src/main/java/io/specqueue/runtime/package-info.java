/**
 * Runtime orchestration package.
 *
 * <p>{@link io.specqueue.runtime.TaskProcessor} owns the persisted queue state and every
 * mutation of it; {@link io.specqueue.runtime.QueueDaemon} drives it from per-source worker
 * threads woken by directory watchers.
 */
package io.specqueue.runtime;
