package com.hypothesis.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the GO annotation (GAF) file, {@code app.gaf} namespace.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.gaf")
public class GafProperties {

    @NotBlank
    private String filePath = "data/gaf/goa_human.gaf";
}
