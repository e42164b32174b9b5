/**
 * Cross-chain post replication.
 *
 * <p>{@link io.postrelay.relay.PostTransmitter} hands outbound packets to the channel keeper.
 * {@link io.postrelay.relay.PostReceiver} applies inbound posts on the counterparty. On the
 * originating chain exactly one of {@link io.postrelay.relay.AckReconciler} and
 * {@link io.postrelay.relay.TimeoutReconciler} settles each packet.
 * {@link io.postrelay.relay.PostPacketModule} is the transport-facing adapter that decodes
 * packet bytes and builds acknowledgements around those four operations.
 */
package io.postrelay.relay;
