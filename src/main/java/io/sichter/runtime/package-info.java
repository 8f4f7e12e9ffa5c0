/**
 * Wiring package.
 *
 * <p>{@link io.sichter.runtime.SichterRuntime} builds the queue, event log and job ledger from one
 * {@link io.sichter.config.SichterConfig} and hands them to the worker, the overview and the
 * gateway used by the CLI.
 */
package io.sichter.runtime;
