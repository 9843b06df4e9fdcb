package com.github.yoep.torrent.adapter;

import com.github.yoep.torrent.adapter.model.ReadyLink;
import com.github.yoep.torrent.adapter.model.TorrentFile;
import com.github.yoep.torrent.adapter.model.TorrentHandle;
import com.github.yoep.torrent.adapter.state.UnlockState;

import java.util.List;

/**
 * The lifecycle of a single torrent within the unlock service.
 * Each step can only be invoked once, in order, and a failing step moves the session into {@link UnlockState#FAILED}.
 * The polling steps block the invoking thread and abort with {@link UnlockCancelledException} when it's interrupted.
 */
public interface UnlockSession {
    /**
     * Get the handle of the registered torrent.
     *
     * @return Returns the torrent handle.
     */
    TorrentHandle getHandle();

    /**
     * Get the current state of the session.
     *
     * @return Returns the session state.
     */
    UnlockState getState();

    /**
     * Wait for the file manifest of the torrent to become available.
     *
     * @return Returns the non-empty file manifest.
     * @throws MetadataTimeoutException Is thrown when the manifest didn't become available in time.
     * @throws UnlockCancelledException Is thrown when the invoking thread has been interrupted.
     */
    List<TorrentFile> awaitMetadata();

    /**
     * Select the file which should be unlocked.
     *
     * @param fileId The remote id of the file.
     * @throws InvalidSelectionException Is thrown when the file id is {@link TorrentFile#NONE}.
     */
    void selectFile(int fileId);

    /**
     * Wait for the selected file to become available through ready links.
     *
     * @return Returns the non-empty list of ready links.
     * @throws LinksTimeoutException    Is thrown when no link became available in time.
     * @throws UnlockCancelledException Is thrown when the invoking thread has been interrupted.
     */
    List<ReadyLink> awaitReadyLinks();

    /**
     * Unrestrict the given ready link of this torrent.
     *
     * @param link The ready link to unrestrict.
     * @return Returns the playable download url.
     */
    String unrestrict(ReadyLink link);
}
