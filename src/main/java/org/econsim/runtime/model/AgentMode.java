package org.econsim.runtime.model;

/**
 * Behavioral mode of an agent as of the end of the last step.
 * The mode is descriptive only; the decision procedure does not read it.
 */
public enum AgentMode {
    IDLE,
    FORAGING,
    SEEKING_PARTNER,
    PAIRED,
    TRADING
}
