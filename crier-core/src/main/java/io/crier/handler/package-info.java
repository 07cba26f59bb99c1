/**
 * Type-erasing adapters between user handlers and the subscription registry.
 *
 * <p>{@link io.crier.handler.SharedHandlerAdapter} wraps read-only handlers;
 * {@link io.crier.handler.ExclusiveHandlerAdapter} wraps mutating handlers behind a private
 * lock. Both match events by exact runtime class and silently skip everything else.
 *
 * @see io.crier.handler.DynamicHandler
 */
package io.crier.handler;
