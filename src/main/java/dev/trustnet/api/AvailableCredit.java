/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

/**
 * Remaining capacity of a line seen from one participant.
 *
 * @param canSend largest amount the participant can still pay to the counterparty
 * @param canReceive largest amount the counterparty can still pay to the participant
 */
public record AvailableCredit(long canSend, long canReceive) {}
