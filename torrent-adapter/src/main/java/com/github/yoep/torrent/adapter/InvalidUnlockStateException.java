package com.github.yoep.torrent.adapter;

import com.github.yoep.torrent.adapter.state.UnlockState;
import lombok.Getter;

import java.text.MessageFormat;

@Getter
public class InvalidUnlockStateException extends UnlockException {
    private final UnlockState state;
    private final UnlockState expectedState;

    public InvalidUnlockStateException(UnlockState state, UnlockState expectedState) {
        super(MessageFormat.format("Unlock session is in an invalid state \"{0}\", expected \"{1}\"", state, expectedState));
        this.state = state;
        this.expectedState = expectedState;
    }
}
