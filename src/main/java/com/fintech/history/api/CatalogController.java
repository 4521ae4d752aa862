package com.fintech.history.api;

import com.fintech.history.catalog.CatalogSnapshot;
import com.fintech.history.domain.Category;
import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.service.HistoryQueryService;
import com.fintech.history.storage.ShardConnectionPool;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Shard discovery and data inventory.
 */
@RestController
@RequestMapping("/api/v1/catalog")
@Validated
@Tag(name = "Catalog", description = "Shard discovery and coverage")
public class CatalogController {

    private static final Logger log = LoggerFactory.getLogger(CatalogController.class);

    private final HistoryQueryService queryService;
    private final ShardConnectionPool pool;

    public CatalogController(HistoryQueryService queryService, ShardConnectionPool pool) {
        this.queryService = queryService;
        this.pool = pool;
    }

    @Operation(
        summary = "List shards",
        description = "Lists catalogued shard files, optionally narrowed to a category and symbol.",
        tags = {"Catalog"}
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Shards listed",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        [
                          {
                            "id": "indices_SPX_2024.db",
                            "category": "indices",
                            "symbol": "SPX",
                            "coverageStart": "2024-01-01",
                            "coverageEnd": "2024-12-31",
                            "granularity": "1m",
                            "sizeBytes": 48234496,
                            "degraded": false
                          }
                        ]
                        """
                )
            )
        )
    })
    @GetMapping
    public ResponseEntity<List<ShardView>> listShards(
            @Parameter(description = "Category filter", example = "indices")
            @RequestParam(required = false)
            String category,

            @Parameter(description = "Symbol filter", example = "SPX")
            @RequestParam(required = false)
            String symbol) {

        Optional<Category> categoryFilter = Optional.ofNullable(category).filter(c -> !c.isBlank()).map(Category::parse);
        Optional<String> symbolFilter = Optional.ofNullable(symbol).filter(s -> !s.isBlank());

        List<ShardView> shards = queryService.listShards(categoryFilter, symbolFilter).stream()
            .map(shard -> ShardView.of(shard, pool.isDegraded(shard)))
            .collect(Collectors.toList());
        return ResponseEntity.ok(shards);
    }

    @Operation(
        summary = "Coverage and gaps",
        description = "Reports which parts of a half-open range the catalog holds shards for.",
        tags = {"Catalog"}
    )
    @GetMapping("/coverage")
    public ResponseEntity<CoverageResponse> coverage(
            @Parameter(description = "Category", example = "indices", required = true)
            @RequestParam
            @NotBlank(message = "Category is required and cannot be blank")
            String category,

            @Parameter(description = "Symbol", example = "SPX", required = true)
            @RequestParam
            @NotBlank(message = "Symbol is required and cannot be blank")
            String symbol,

            @Parameter(description = "Stored granularity", example = "1m")
            @RequestParam(defaultValue = "1m")
            String granularity,

            @Parameter(description = "Inclusive start", example = "2024-01-01", required = true)
            @RequestParam
            @NotBlank(message = "From is required")
            String from,

            @Parameter(description = "Exclusive end", example = "2025-01-01", required = true)
            @RequestParam
            @NotBlank(message = "To is required")
            String to) {

        TimeRange range = new TimeRange(
            TimeParameters.toEpochMillis("from", from),
            TimeParameters.toEpochMillis("to", to));
        return ResponseEntity.ok(CoverageResponse.fromReport(
            queryService.coverage(Category.parse(category), symbol, Granularity.parse(granularity), range)));
    }

    @Operation(
        summary = "Rescan the catalog root",
        description = "Publishes a fresh catalog snapshot and clears cached results.",
        tags = {"Catalog"}
    )
    @PostMapping("/refresh")
    public ResponseEntity<RefreshResponse> refresh() {
        CatalogSnapshot snapshot = queryService.refreshCatalog();
        log.info("Catalog refresh requested: shards={}, version={}", snapshot.size(), snapshot.version());
        return ResponseEntity.ok(new RefreshResponse(snapshot.version(), snapshot.size(), snapshot.scannedAt()));
    }

    public record RefreshResponse(long version, int shards, Instant scannedAt) {}
}
