/**
 * Daemon lifecycle package.
 *
 * <p>{@link io.eventrelay.runtime.EventRelayDaemon} owns every stateful component,
 * installs the built-in plugins and turns transport requests into logged, dispatched
 * events.
 */
package io.eventrelay.runtime;
