package com.mimecast.mailstore.pipe;

import org.apache.commons.lang3.StringUtils;

/**
 * Directions of cross-node update exchange.
 *
 * <p>The forwarder always pushes local updates to the pipe.
 * <br>The mode decides whether the pipe also listens for remote updates and whether
 * local updates are copied onto the local update stream.
 */
public enum PipeMode {

    /**
     * Push local updates only. Nothing is copied onto the local stream by the forwarder.
     */
    PUSH("push", false, false),

    /**
     * Listen for remote updates. Local updates are still pushed and copied locally.
     */
    LISTEN("listen", true, true),

    /**
     * Push and listen.
     */
    REPLICATE("replicate", true, true);

    private final String name;
    private final boolean listening;
    private final boolean forwardingLocally;

    PipeMode(String name, boolean listening, boolean forwardingLocally) {
        this.name = name;
        this.listening = listening;
        this.forwardingLocally = forwardingLocally;
    }

    /**
     * Gets configuration name.
     *
     * @return Lower case name.
     */
    public String getName() {
        return name;
    }

    /**
     * Checks if the pipe listener must be activated.
     *
     * @return Boolean.
     */
    public boolean isListening() {
        return listening;
    }

    /**
     * Checks if local updates are copied onto the local update stream.
     *
     * @return Boolean.
     */
    public boolean isForwardingLocally() {
        return forwardingLocally;
    }

    /**
     * Resolves a mode by configuration name, case insensitive.
     *
     * @param name Mode name.
     * @return PipeMode.
     * @throws IllegalArgumentException Unknown mode.
     */
    public static PipeMode fromName(String name) {
        for (PipeMode mode : values()) {
            if (mode.name.equalsIgnoreCase(StringUtils.trimToEmpty(name))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown update pipe mode: " + name);
    }
}
