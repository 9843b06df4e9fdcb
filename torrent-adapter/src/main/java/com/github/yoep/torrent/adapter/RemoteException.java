package com.github.yoep.torrent.adapter;

import lombok.Getter;

import java.text.MessageFormat;

/**
 * Exception indicating that the unlock service responded with a non-successful status or couldn't be reached.
 * A transport failure is reported with status {@link #TRANSPORT_ERROR}.
 */
@Getter
public class RemoteException extends UnlockException {
    /**
     * The status reported when no http response has been received at all.
     */
    public static final int TRANSPORT_ERROR = 0;

    /**
     * The http status code of the failed request, or {@link #TRANSPORT_ERROR} when no response was received.
     */
    private final int status;
    /**
     * The (truncated) response body of the failed request.
     */
    private final String body;

    public RemoteException(int status, String body) {
        super(MessageFormat.format("Unlock service request failed ({0}): {1}", String.valueOf(status), body));
        this.status = status;
        this.body = body;
    }

    public RemoteException(int status, String body, Throwable cause) {
        super(MessageFormat.format("Unlock service request failed ({0}): {1}", String.valueOf(status), body), cause);
        this.status = status;
        this.body = body;
    }
}
