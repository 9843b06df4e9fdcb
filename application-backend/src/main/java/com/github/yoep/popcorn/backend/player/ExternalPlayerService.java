package com.github.yoep.popcorn.backend.player;

import com.github.yoep.popcorn.backend.adapters.player.PlayRequest;
import com.github.yoep.popcorn.backend.adapters.player.PlayerException;
import com.github.yoep.popcorn.backend.adapters.player.PlayerService;
import com.github.yoep.popcorn.backend.config.properties.PlayerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.io.IOException;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;

/**
 * Plays streams by launching an external media player executable.
 */
@Slf4j
@RequiredArgsConstructor
public class ExternalPlayerService implements PlayerService {
    private final PlayerProperties properties;

    @Override
    public void play(PlayRequest request) {
        Assert.notNull(request, "request cannot be null");
        var command = buildCommand(request);
        log.info("Starting playback of \"{}\" with {}", request.getTitle(), properties.getCommand());
        log.debug("Launching player command {}", command);

        try {
            new ProcessBuilder(command)
                    .inheritIO()
                    .start();
        } catch (IOException ex) {
            throw new PlayerException(MessageFormat.format("Failed to launch player \"{0}\", {1}", properties.getCommand(), ex.getMessage()), ex);
        }
    }

    List<String> buildCommand(PlayRequest request) {
        Assert.hasText(request.getUrl(), "url cannot be empty");
        var command = new ArrayList<String>();
        command.add(properties.getCommand());
        command.addAll(properties.getArguments());
        command.add(request.getUrl());
        return command;
    }
}
