/**
 * Composition root.
 *
 * <p>{@link io.agentbridge.runtime.BridgeRuntime} builds the message store,
 * adapter registry, chain executor, health aggregator and audit trail once per
 * process and hands the same instances to the gateway and the CLI.
 */
package io.agentbridge.runtime;
