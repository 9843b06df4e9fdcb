package com.github.yoep.popcorn.backend.config.properties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotNull;
import java.net.URI;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProviderProperties {
    /**
     * The base url of the API that should be used by the provider.
     */
    @NotNull
    private URI url;
}
