package com.github.yoep.popcorn.backend.config.properties;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;

@Data
public class PlayerProperties {
    /**
     * The executable of the external media player.
     */
    @NotBlank
    private String command = "mpv";

    /**
     * The additional arguments passed to the player before the url.
     */
    private List<String> arguments = new ArrayList<>();
}
