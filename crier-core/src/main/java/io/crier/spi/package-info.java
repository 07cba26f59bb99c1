/**
 * Extension points implemented outside the core module.
 */
package io.crier.spi;
