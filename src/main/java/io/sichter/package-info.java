/**
 * Sichter source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sichter.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.sichter.cli.SichterCommand} maps commands to the runtime.</li>
 *   <li>{@code io.sichter.queue.JobQueue} holds pending jobs as files.</li>
 *   <li>{@code io.sichter.worker.WorkerLoop} consumes the queue and writes events.</li>
 *   <li>{@code io.sichter.events.EventLog} is the append-only event record.</li>
 *   <li>{@code io.sichter.gateway.GatewayServer} serves the HTTP API and the live stream.</li>
 * </ul>
 */
package io.sichter;
