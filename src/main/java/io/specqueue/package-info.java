/**
 * spec-queue source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.specqueue.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.specqueue.cli.SpecQueueCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.specqueue.runtime.TaskProcessor} merges scans, dispatches tasks and records outcomes.</li>
 *   <li>{@code io.specqueue.runtime.QueueDaemon} runs one worker per source in long-running mode.</li>
 * </ul>
 */
package io.specqueue;
