package com.ghlinker.reactions;

public enum Outcome {
    /** An authorized user confirmed and the message is gone. */
    DELETED,
    /** Nobody confirmed in time; the affordance reactions were cleared. */
    EXPIRED,
    /** The message disappeared before the prompt could resolve. */
    ABORTED
}
