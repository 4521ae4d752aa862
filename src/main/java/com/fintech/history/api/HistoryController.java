package com.fintech.history.api;

import com.fintech.history.domain.BarQueryResult;
import com.fintech.history.domain.Category;
import com.fintech.history.domain.ChainResult;
import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.service.HistoryQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * REST API for bar and option chain queries over the shard catalog.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Market History", description = "Historical bars and option chains")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    private final HistoryQueryService queryService;
    private final MeterRegistry meterRegistry;

    public HistoryController(HistoryQueryService queryService, MeterRegistry meterRegistry) {
        this.queryService = queryService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /api/v1/bars
     *
     * Bars for one symbol over a half-open range. Granularities wider than the stored one
     * are rolled up server-side.
     */
    @Operation(
        summary = "Get historical bars",
        description = """
            Retrieves OHLCV bars for a symbol across every shard covering the range.
            Ranges are half-open: `from` is inclusive, `to` exclusive.

            **Supported Granularities:** 1m, 5m, 15m, 30m, 1h, 1d

            **Example Request:**
            ```
            GET /api/v1/bars?category=indices&symbol=SPX&from=2024-01-02&to=2024-01-04&granularity=1d
            ```
            """,
        tags = {"Market History"}
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Bars retrieved; `partial` is true when a shard could not be read",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = BarsResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "s": "ok",
                          "t": [1704153600, 1704240000],
                          "o": [4745.2, 4704.1],
                          "h": [4754.3, 4729.3],
                          "l": [4722.7, 4699.7],
                          "c": [4742.8, 4704.8],
                          "v": [0, 0],
                          "granularity": "1d",
                          "sourceGranularity": "1m",
                          "partial": false,
                          "shards": ["indices_SPX_2024.db"],
                          "unavailableShards": []
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid range, category or granularity",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "No shard exists for the symbol",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Every required shard is unavailable",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/bars")
    public ResponseEntity<BarsResponse> getBars(
            @Parameter(description = "Category: indices, etfs or stocks", example = "indices", required = true)
            @RequestParam
            @NotBlank(message = "Category is required and cannot be blank")
            String category,

            @Parameter(description = "Symbol as it appears in shard file names", example = "SPX", required = true)
            @RequestParam
            @NotBlank(message = "Symbol is required and cannot be blank")
            @Pattern(regexp = "^[A-Za-z0-9.\\-]{1,20}$", message = "Symbol must be 1-20 letters, digits, dots or dashes")
            String symbol,

            @Parameter(description = "Inclusive start: ISO date, ISO instant or epoch ms", example = "2024-01-02",
                required = true)
            @RequestParam
            @NotBlank(message = "From is required")
            String from,

            @Parameter(description = "Exclusive end: ISO date, ISO instant or epoch ms", example = "2024-01-04",
                required = true)
            @RequestParam
            @NotBlank(message = "To is required")
            String to,

            @Parameter(description = "Bar width: 1m, 5m, 15m, 30m, 1h, 1d", example = "1m")
            @RequestParam(defaultValue = "1m")
            String granularity) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Category parsedCategory = Category.parse(category);
            Granularity parsedGranularity = Granularity.parse(granularity);
            TimeRange range = new TimeRange(
                TimeParameters.toEpochMillis("from", from),
                TimeParameters.toEpochMillis("to", to));

            BarQueryResult result = queryService.getBars(parsedCategory, symbol, range, parsedGranularity);

            log.debug("Bars query: category={}, symbol={}, granularity={}, range={}, results={}, partial={}",
                parsedCategory.prefix(), symbol, parsedGranularity.canonical(), range, result.bars().size(),
                result.partialCoverage());
            return ResponseEntity.ok(BarsResponse.fromResult(result));
        } finally {
            sample.stop(meterRegistry.timer("api.bars.request.time", "granularity", granularity));
        }
    }

    /**
     * GET /api/v1/options/chain
     */
    @Operation(
        summary = "Get option chain around the money",
        description = """
            Resolves spot from the underlying's bars, then lists `window` strikes either side of
            the at-the-money strike for each option type, with the latest quote of the day and
            Black-Scholes Greeks.

            Contracts whose volatility cannot be solved are listed with status `IV_CONVERGENCE_FAILED`.

            **Example Request:**
            ```
            GET /api/v1/options/chain?underlying=SPX&date=2024-03-15&window=10
            ```
            """,
        tags = {"Market History"}
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Chain resolved",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ChainResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "underlying": "SPX",
                          "date": "2024-03-15",
                          "expiry": "2024-03-15",
                          "spot": 5117.09,
                          "atmStrike": 5115,
                          "strikeWindow": 10,
                          "partial": false,
                          "shards": ["options_SPX_2024_03.db"],
                          "unavailableShards": [],
                          "contracts": [
                            {
                              "contract": "O:SPXW240315C05115000",
                              "type": "CALL",
                              "strike": 5115,
                              "mid": 7.45,
                              "iv": 0.142,
                              "delta": 0.53,
                              "status": "OK"
                            }
                          ]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "404",
            description = "No option shard or spot source for the underlying",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/options/chain")
    public ResponseEntity<ChainResponse> getChain(
            @Parameter(description = "Underlying symbol", example = "SPX", required = true)
            @RequestParam
            @NotBlank(message = "Underlying is required and cannot be blank")
            @Pattern(regexp = "^[A-Za-z0-9.\\-]{1,20}$", message = "Underlying must be 1-20 letters, digits, dots or dashes")
            String underlying,

            @Parameter(description = "Trading date (ISO)", example = "2024-03-15", required = true)
            @RequestParam
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            LocalDate date,

            @Parameter(description = "Strikes either side of the money", example = "10")
            @RequestParam(required = false)
            @Min(value = 0, message = "Window cannot be negative")
            @Max(value = 100, message = "Window cannot exceed 100")
            Integer window,

            @Parameter(description = "Expiry (ISO); defaults to the nearest on or after date", example = "2024-03-15")
            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            LocalDate expiry) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ChainResult result = queryService.getChain(underlying, date, window, expiry);
            log.debug("Chain query: underlying={}, date={}, expiry={}, entries={}",
                underlying, date, result.expiry(), result.entries().size());
            return ResponseEntity.ok(ChainResponse.fromResult(result));
        } finally {
            sample.stop(meterRegistry.timer("api.chain.request.time"));
        }
    }
}
