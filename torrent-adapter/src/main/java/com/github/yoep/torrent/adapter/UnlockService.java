package com.github.yoep.torrent.adapter;

/**
 * The unlock service fetches torrent content on a remote server and exposes it as direct download links.
 */
public interface UnlockService {
    /**
     * Check if the unlock service can be used.
     * This is the case when an access token has been configured.
     *
     * @return Returns true when the service is enabled.
     */
    boolean isEnabled();

    /**
     * Register the given magnet within the unlock service.
     *
     * @param magnet The magnet uri to register.
     * @return Returns the unlock session of the registered torrent.
     * @throws RemoteException      Is thrown when the service couldn't be reached or rejected the request.
     * @throws EmptyHandleException Is thrown when the service didn't return a torrent id.
     */
    UnlockSession register(String magnet);

    /**
     * Unrestrict the given link into a playable download url.
     *
     * @param link The link to unrestrict.
     * @return Returns the playable download url.
     * @throws RemoteException           Is thrown when the service couldn't be reached or rejected the request.
     * @throws EmptyDownloadUrlException Is thrown when the service didn't return a download url.
     */
    String unrestrict(String link);
}
