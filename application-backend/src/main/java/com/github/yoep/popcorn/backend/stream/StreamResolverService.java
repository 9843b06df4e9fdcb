package com.github.yoep.popcorn.backend.stream;

import com.github.yoep.torrent.adapter.DescriptorNormalizer;
import com.github.yoep.torrent.adapter.FileSelector;
import com.github.yoep.torrent.adapter.NoPlayableSourceException;
import com.github.yoep.torrent.adapter.UnlockCancelledException;
import com.github.yoep.torrent.adapter.UnlockService;
import com.github.yoep.torrent.adapter.model.PlayableReference;
import com.github.yoep.torrent.adapter.model.StreamDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves stream descriptors into playable urls.
 * When the unlock service is enabled, torrents are unlocked into direct download urls.
 * Any failure of the unlock service results in the original url being returned instead.
 */
@Slf4j
@RequiredArgsConstructor
public class StreamResolverService {
    private final UnlockService unlockService;
    private final AsyncTaskExecutor taskExecutor;
    private final Duration resolveTimeout;

    /**
     * Resolve the given descriptor, unlocking it when the unlock service is enabled.
     *
     * @param descriptor The stream descriptor to resolve.
     * @return Returns the resolved stream.
     * @throws NoPlayableSourceException Is thrown when the descriptor doesn't contain a playable source.
     */
    public ResolvedStream resolve(StreamDescriptor descriptor) {
        return resolve(descriptor, unlockService.isEnabled());
    }

    /**
     * Resolve the given descriptor.
     * The calling thread is blocked while the unlock service is polled, interrupting it cancels the unlock.
     *
     * @param descriptor    The stream descriptor to resolve.
     * @param unlockEnabled Indicates if the unlock service should be used.
     * @return Returns the resolved stream.
     * @throws NoPlayableSourceException Is thrown when the descriptor doesn't contain a playable source.
     */
    public ResolvedStream resolve(StreamDescriptor descriptor, boolean unlockEnabled) {
        Assert.notNull(descriptor, "descriptor cannot be null");
        if (!descriptor.isResolvable()) {
            throw new NoPlayableSourceException(descriptor.getDisplayName());
        }

        var reference = DescriptorNormalizer.normalize(descriptor);
        log.trace("Stream {} has been normalized to {}", descriptor.getDisplayName(), reference);

        return switch (reference.kind()) {
            case DIRECT_URL -> resolveDirectUrl(reference, unlockEnabled);
            case MAGNET_URI, HASH_SYNTHESIZED -> resolveMagnet(descriptor, reference, unlockEnabled);
        };
    }

    /**
     * Resolve the given descriptor on the background executor.
     * The resolution is cancelled when it didn't complete within the configured resolve timeout,
     * or when the returned future is cancelled.
     *
     * @param descriptor The stream descriptor to resolve.
     * @return Returns the future of the resolved stream.
     */
    public CompletableFuture<ResolvedStream> resolveAsync(StreamDescriptor descriptor) {
        Assert.notNull(descriptor, "descriptor cannot be null");
        var resolution = new CompletableFuture<ResolvedStream>();
        var result = new CompletableFuture<ResolvedStream>();
        var task = taskExecutor.submit(() -> {
            try {
                resolution.complete(resolve(descriptor));
            } catch (RuntimeException ex) {
                resolution.completeExceptionally(ex);
            }
        });

        // the deadline timer is released as soon as the resolution completes
        resolution.orTimeout(resolveTimeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((stream, ex) -> {
            if (ex instanceof TimeoutException) {
                log.warn("Stream {} couldn't be resolved within {}, cancelling the resolution", descriptor.getDisplayName(), resolveTimeout);
                task.cancel(true);
                completeAsCancelled(result, descriptor);
            } else if (ex != null) {
                result.completeExceptionally(ex);
            } else {
                result.complete(stream);
            }
        });
        result.whenComplete((stream, ex) -> {
            if (result.isCancelled()) {
                log.debug("Resolution of stream {} has been cancelled", descriptor.getDisplayName());
                task.cancel(true);
                resolution.cancel(false);
            }
        });

        return result;
    }

    private static void completeAsCancelled(CompletableFuture<ResolvedStream> result, StreamDescriptor descriptor) {
        var reference = descriptor.isResolvable() ? DescriptorNormalizer.normalize(descriptor) : null;

        if (reference != null && reference.isAvailable()) {
            result.complete(ResolvedStream.cancelled(reference.url()));
        } else {
            result.completeExceptionally(new NoPlayableSourceException(descriptor.getDisplayName()));
        }
    }

    private ResolvedStream resolveDirectUrl(PlayableReference reference, boolean unlockEnabled) {
        var url = reference.url();
        if (!unlockEnabled) {
            return ResolvedStream.passthrough(url);
        }

        try {
            return ResolvedStream.unlocked(unlockService.unrestrict(url));
        } catch (RuntimeException ex) {
            return fallback(url, ex);
        }
    }

    private ResolvedStream resolveMagnet(StreamDescriptor descriptor, PlayableReference reference, boolean unlockEnabled) {
        if (!reference.isAvailable()) {
            throw new NoPlayableSourceException(descriptor.getDisplayName());
        }

        var magnet = reference.url();
        if (!unlockEnabled) {
            return ResolvedStream.passthrough(magnet);
        }

        try {
            return ResolvedStream.unlocked(unlock(magnet, descriptor.getExplicitFileIndex().orElse(null)));
        } catch (RuntimeException ex) {
            return fallback(magnet, ex);
        }
    }

    private String unlock(String magnet, Integer explicitIndex) {
        var session = unlockService.register(magnet);

        var files = session.awaitMetadata();
        var fileId = FileSelector.select(files, explicitIndex);
        log.debug("Selected file {} of torrent {}", fileId, session.getHandle().id());
        session.selectFile(fileId);

        var links = session.awaitReadyLinks();
        var url = session.unrestrict(links.get(0));
        log.info("Torrent {} has been unlocked", session.getHandle().id());

        return url;
    }

    private static ResolvedStream fallback(String url, RuntimeException ex) {
        if (ex instanceof UnlockCancelledException || Thread.currentThread().isInterrupted()) {
            log.debug("Stream unlock has been cancelled, {}", ex.getMessage());
            Thread.currentThread().interrupt();
            return ResolvedStream.cancelled(url);
        }

        log.warn("Failed to unlock stream, falling back to the original url, {}", ex.getMessage(), ex);
        return ResolvedStream.fallback(url);
    }
}
