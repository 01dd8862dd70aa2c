package uk.gegc.readlater.features.libraryitem.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for library search, prefix lookup and retention windows.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "app.library")
public class LibraryProperties {

    @Valid
    private Search search = new Search();

    @Valid
    private PrefixSearch prefixSearch = new PrefixSearch();

    /**
     * How long soft-deleted items stay visible in the trash scope.
     */
    @NotNull(message = "Property app.library.trash-retention-days must be configured")
    @Min(value = 1, message = "app.library.trash-retention-days must be at least 1")
    private Integer trashRetentionDays = 14;

    /**
     * Top reading-progress percentage at which an item counts as read.
     */
    @NotNull(message = "Property app.library.read-threshold-percent must be configured")
    @Min(value = 0, message = "app.library.read-threshold-percent must not be negative")
    @Max(value = 100, message = "app.library.read-threshold-percent must not exceed 100")
    private Integer readThresholdPercent = 98;

    @Data
    public static class Search {

        @NotNull(message = "Property app.library.search.default-page-size must be configured")
        @Min(value = 1, message = "app.library.search.default-page-size must be at least 1")
        private Integer defaultPageSize = 10;

        @NotNull(message = "Property app.library.search.max-page-size must be configured")
        @Min(value = 1, message = "app.library.search.max-page-size must be at least 1")
        private Integer maxPageSize = 100;
    }

    @Data
    public static class PrefixSearch {

        @NotNull(message = "Property app.library.prefix-search.default-limit must be configured")
        @Min(value = 1, message = "app.library.prefix-search.default-limit must be at least 1")
        private Integer defaultLimit = 5;

        @NotNull(message = "Property app.library.prefix-search.max-limit must be configured")
        @Min(value = 1, message = "app.library.prefix-search.max-limit must be at least 1")
        private Integer maxLimit = 50;
    }
}
