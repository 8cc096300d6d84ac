/**
 * EventRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.eventrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.eventrelay.cli.EventRelayCommand} maps commands to daemon and client calls.</li>
 *   <li>{@code io.eventrelay.runtime.EventRelayDaemon} wires the log, dispatcher, job registry and transports.</li>
 *   <li>{@code io.eventrelay.log.EventLog} is the ordered source of truth every subscriber reads from.</li>
 * </ul>
 */
package io.eventrelay;
