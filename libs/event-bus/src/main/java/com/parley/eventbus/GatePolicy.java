package com.parley.eventbus;

/** What a {@link GatedChannel} does with events published while authorization is pending. */
public enum GatePolicy {

    /** Hold them in the channel's bounded buffer and deliver them on approval. */
    BUFFER,

    /** Discard them. */
    DROP
}
