/**
 * Subscription storage.
 *
 * @see io.crier.registry.SubscriptionRegistry
 */
package io.crier.registry;
