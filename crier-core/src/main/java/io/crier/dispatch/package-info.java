/**
 * Dispatch engine: bounded parallel fan-out of shared handlers and serialized invocation of
 * exclusive handlers.
 */
package io.crier.dispatch;
