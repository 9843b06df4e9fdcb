package com.github.yoep.torrent.adapter.state;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UnlockStateTest {
    @Test
    void testNext_shouldMoveForwardInOrder() {
        assertEquals(UnlockState.METADATA_READY, UnlockState.REGISTERED.next());
        assertEquals(UnlockState.FILE_SELECTED, UnlockState.METADATA_READY.next());
        assertEquals(UnlockState.LINKS_READY, UnlockState.FILE_SELECTED.next());
        assertEquals(UnlockState.UNRESTRICTED, UnlockState.LINKS_READY.next());
    }

    @Test
    void testNext_whenStateIsTerminal_shouldReturnFailed() {
        assertEquals(UnlockState.FAILED, UnlockState.UNRESTRICTED.next());
        assertEquals(UnlockState.FAILED, UnlockState.FAILED.next());
    }
}
