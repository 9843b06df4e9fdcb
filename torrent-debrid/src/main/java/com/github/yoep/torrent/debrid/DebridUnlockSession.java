package com.github.yoep.torrent.debrid;

import com.github.yoep.torrent.adapter.*;
import com.github.yoep.torrent.adapter.model.ReadyLink;
import com.github.yoep.torrent.adapter.model.TorrentFile;
import com.github.yoep.torrent.adapter.model.TorrentHandle;
import com.github.yoep.torrent.adapter.state.UnlockState;
import com.github.yoep.torrent.debrid.model.TorrentInfoResponse;
import com.github.yoep.torrent.debrid.polling.PollingPolicy;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * The lifecycle of a single torrent registered within Real-Debrid.
 */
@Slf4j
@ToString(of = {"handle", "state"})
public class DebridUnlockSession implements UnlockSession {
    private final DebridUnlockService service;
    private final TorrentHandle handle;

    private volatile UnlockState state = UnlockState.REGISTERED;

    DebridUnlockSession(DebridUnlockService service, TorrentHandle handle) {
        this.service = service;
        this.handle = handle;
    }

    //region Getters

    @Override
    public TorrentHandle getHandle() {
        return handle;
    }

    @Override
    public UnlockState getState() {
        return state;
    }

    //endregion

    //region UnlockSession

    @Override
    public List<TorrentFile> awaitMetadata() {
        return transition(UnlockState.REGISTERED, () -> {
            var info = service.getPoller().poll("metadata of torrent " + handle.id(), PollingPolicy.METADATA,
                    () -> service.info(handle),
                    e -> !e.getFiles().isEmpty(),
                    () -> new MetadataTimeoutException(handle.id(), PollingPolicy.METADATA.attempts()));

            return toTorrentFiles(info.getFiles());
        });
    }

    @Override
    public void selectFile(int fileId) {
        transition(UnlockState.METADATA_READY, () -> {
            if (fileId == TorrentFile.NONE) {
                throw new InvalidSelectionException("Failed to pick a torrent file of " + handle.id());
            }

            service.selectFiles(handle, fileId);
            return fileId;
        });
    }

    @Override
    public List<ReadyLink> awaitReadyLinks() {
        return transition(UnlockState.FILE_SELECTED, () -> {
            var info = service.getPoller().poll("links of torrent " + handle.id(), PollingPolicy.READY_LINKS,
                    () -> service.info(handle),
                    e -> e.getLinks().stream().anyMatch(StringUtils::isNotBlank),
                    () -> new LinksTimeoutException(handle.id(), PollingPolicy.READY_LINKS.attempts()));

            return info.getLinks().stream()
                    .filter(StringUtils::isNotBlank)
                    .map(ReadyLink::new)
                    .collect(Collectors.toList());
        });
    }

    @Override
    public String unrestrict(ReadyLink link) {
        return transition(UnlockState.LINKS_READY, () -> service.unrestrict(link.url()));
    }

    //endregion

    //region Functions

    private <T> T transition(UnlockState expectedState, Supplier<T> step) {
        if (state != expectedState) {
            var currentState = state;
            state = UnlockState.FAILED;
            throw new InvalidUnlockStateException(currentState, expectedState);
        }

        try {
            var result = step.get();
            state = expectedState.next();
            log.trace("Torrent {} moved to state {}", handle.id(), state);
            return result;
        } catch (UnlockException ex) {
            log.debug("Torrent {} failed in state {}, {}", handle.id(), expectedState, ex.getMessage());
            state = UnlockState.FAILED;
            throw ex;
        }
    }

    private static List<TorrentFile> toTorrentFiles(List<TorrentInfoResponse.File> files) {
        return IntStream.range(0, files.size())
                .mapToObj(i -> TorrentFile.builder()
                        .index(i)
                        .id(files.get(i).getId())
                        .path(files.get(i).getPath())
                        .size(files.get(i).getBytes())
                        .build())
                .collect(Collectors.toList());
    }

    //endregion
}
