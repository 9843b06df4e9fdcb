package com.github.yoep.torrent.adapter.state;

/**
 * The state of a torrent within the remote unlock service.
 * States only move forward in the declared order, except for {@link #FAILED} which can be reached from any state.
 */
public enum UnlockState {
    /**
     * The magnet has been registered and a torrent handle has been assigned.
     */
    REGISTERED,
    /**
     * The file manifest of the torrent is known.
     */
    METADATA_READY,
    /**
     * A single file of the torrent has been selected for unlocking.
     */
    FILE_SELECTED,
    /**
     * The selected file is available through one or more ready links.
     */
    LINKS_READY,
    /**
     * A ready link has been unrestricted into a playable url.
     */
    UNRESTRICTED,
    /**
     * A step of the unlock process failed, the session can no longer be used.
     */
    FAILED;

    /**
     * Get the state which directly follows this state.
     *
     * @return Returns the next state, or {@link #FAILED} for the terminal states.
     */
    public UnlockState next() {
        return switch (this) {
            case REGISTERED -> METADATA_READY;
            case METADATA_READY -> FILE_SELECTED;
            case FILE_SELECTED -> LINKS_READY;
            case LINKS_READY -> UNRESTRICTED;
            case UNRESTRICTED, FAILED -> FAILED;
        };
    }
}
