package com.example.datalake.fieldcheck.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "fieldcheck")
public class FieldCheckProperties {

    /** Message used by validators that were built without one. */
    @NotBlank
    private String defaultMessage = "Invalid value";

    @Valid
    private Store store = new Store();

    @Data
    public static class Store {

        @NotBlank
        private String idColumn = "id";

        /** Table name to {@code {field}} label template, e.g. {@code countries: "{name} ({code})"}. */
        private Map<String, String> displayFormats = new LinkedHashMap<>();
    }
}
