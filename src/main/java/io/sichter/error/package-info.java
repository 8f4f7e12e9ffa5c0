/**
 * Error taxonomy shared by the queue, worker, gateway and client.
 *
 * <p>Each type maps to one handling policy: {@link io.sichter.error.ValidationException} is
 * answered with a 4xx, {@link io.sichter.error.CollaboratorException} becomes a
 * {@code job.failed} event, {@link io.sichter.error.TransportException} switches a client to
 * polling, and {@link io.sichter.error.StorageException} stops the worker loop.
 */
package io.sichter.error;
