/**
 * postrelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.postrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.postrelay.cli.PostRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.postrelay.runtime.PostRelayRuntime} wires one chain's stores and relay components.</li>
 *   <li>{@code io.postrelay.relay} holds the send, receive, acknowledgement and timeout operations.</li>
 * </ul>
 */
package io.postrelay;
