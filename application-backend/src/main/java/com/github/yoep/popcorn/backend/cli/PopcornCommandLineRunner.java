package com.github.yoep.popcorn.backend.cli;

import com.github.yoep.popcorn.backend.media.providers.CatalogProviderService;
import com.github.yoep.popcorn.backend.media.providers.StreamProviderService;
import com.github.yoep.popcorn.backend.media.providers.models.MediaItem;
import com.github.yoep.popcorn.backend.media.providers.models.MediaType;
import com.github.yoep.popcorn.backend.playback.PlaybackService;
import com.github.yoep.torrent.adapter.StreamException;
import com.github.yoep.torrent.adapter.model.StreamDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.boot.CommandLineRunner;

import java.io.PrintStream;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exposes the catalog, stream and playback services on the command line.
 */
@Slf4j
@RequiredArgsConstructor
public class PopcornCommandLineRunner implements CommandLineRunner {
    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  popular",
            "  search <query>",
            "  episodes <series-id>",
            "  streams <movie|series> <id> [season episode]",
            "  play <movie|series> <id> [season episode] [stream-index]");

    private final CatalogProviderService catalogProviderService;
    private final StreamProviderService streamProviderService;
    private final PlaybackService playbackService;
    private final PrintStream out;

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            out.println(USAGE);
            return;
        }

        var command = args[0].toLowerCase(Locale.ROOT);
        var arguments = Arrays.copyOfRange(args, 1, args.length);
        log.debug("Executing command {} with arguments {}", command, arguments);

        try {
            switch (command) {
                case "popular" -> popular();
                case "search" -> search(arguments);
                case "episodes" -> episodes(arguments);
                case "streams" -> streams(arguments);
                case "play" -> play(arguments);
                default -> out.println(USAGE);
            }
        } catch (IllegalArgumentException ex) {
            out.println(ex.getMessage());
            out.println(USAGE);
        } catch (InterruptedException ex) {
            log.debug("Command {} has been interrupted", command);
            Thread.currentThread().interrupt();
        } catch (ExecutionException | CompletionException ex) {
            onFailure(command, ex.getCause());
        } catch (StreamException ex) {
            onFailure(command, ex);
        }
    }

    private void onFailure(String command, Throwable cause) {
        log.error("Command {} failed, {}", command, cause.getMessage(), cause);
        out.println("Error: " + cause.getMessage());
    }

    private void popular() throws InterruptedException, ExecutionException {
        var popular = catalogProviderService.getPopular().get();
        out.println("Movies");
        printItems(popular.getMovies());
        out.println("Series");
        printItems(popular.getSeries());
    }

    private void search(String[] arguments) throws InterruptedException, ExecutionException {
        var query = String.join(" ", arguments);
        if (StringUtils.isBlank(query)) {
            throw new IllegalArgumentException("Missing search query");
        }

        printItems(catalogProviderService.search(query).get());
    }

    private void episodes(String[] arguments) throws InterruptedException, ExecutionException {
        requireArguments(arguments, 1);
        catalogProviderService.getEpisodes(arguments[0]).get()
                .forEach((season, episodes) -> out.println(MessageFormat.format("Season {0}: {1}", season, episodes)));
    }

    private void streams(String[] arguments) throws InterruptedException, ExecutionException {
        var streams = fetchStreams(arguments).get();
        for (int i = 0; i < streams.size(); i++) {
            var stream = streams.get(i);
            out.println(MessageFormat.format("[{0}] {1} {2}", i, stream.getDisplayName(), StringUtils.replace(stream.getTitle(), "\n", " ")));
        }
    }

    private void play(String[] arguments) throws InterruptedException, ExecutionException {
        var item = toMediaItem(arguments);
        var indexPosition = item.isSeries() ? 4 : 2;
        var index = arguments.length > indexPosition ? NumberUtils.toInt(arguments[indexPosition], -1) : 0;
        var streams = fetchStreams(arguments).get();

        if (index < 0 || index >= streams.size()) {
            throw new IllegalArgumentException(MessageFormat.format("Stream index {0} is not available, {1} streams found", index, streams.size()));
        }

        var resolved = playbackService.play(item.getId(), streams.get(index)).get();
        out.println(MessageFormat.format("Playing {0} ({1})", resolved.url(), resolved.status()));
    }

    private CompletableFuture<List<StreamDescriptor>> fetchStreams(String[] arguments) {
        var item = toMediaItem(arguments);
        var season = 0;
        var episode = 0;

        if (item.isSeries()) {
            requireArguments(arguments, 4);
            season = NumberUtils.toInt(arguments[2]);
            episode = NumberUtils.toInt(arguments[3]);
        }

        return streamProviderService.getStreams(item, season, episode);
    }

    private void printItems(List<MediaItem> items) {
        items.forEach(e -> out.println(MessageFormat.format("  {0} {1} ({2,number,#}) [{3}]", e.getId(), e.getName(), e.getYear(), e.getType().getKey())));
    }

    private static MediaItem toMediaItem(String[] arguments) {
        requireArguments(arguments, 2);
        var type = MediaType.fromKey(arguments[0]);
        if (type == MediaType.UNKNOWN) {
            throw new IllegalArgumentException("Unsupported media type " + arguments[0]);
        }

        return MediaItem.builder()
                .id(arguments[1])
                .name(arguments[1])
                .type(type)
                .build();
    }

    private static void requireArguments(String[] arguments, int count) {
        if (arguments.length < count) {
            throw new IllegalArgumentException("Missing arguments");
        }
    }
}
