package com.williamcallahan.orderedlists.web;

import com.williamcallahan.orderedlists.domain.errors.ApiResponse;
import com.williamcallahan.orderedlists.domain.lists.ListEditOutcome;
import com.williamcallahan.orderedlists.domain.lists.MarkerSettings;
import com.williamcallahan.orderedlists.domain.lists.ParsedList;
import com.williamcallahan.orderedlists.service.ListMarkerService;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for list parsing and editing.
 *
 * <p>Every endpoint takes the full document as a list of lines and returns the parsed structure
 * or the changes an edit needs. Rejected edits are ordinary results with status
 * {@code rejected}; only malformed requests produce error responses.</p>
 */
@RestController
@RequestMapping("/api/lists")
public class ListMarkerController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ListMarkerController.class);

    private final ListMarkerService listMarkerService;

    public ListMarkerController(ListMarkerService listMarkerService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.listMarkerService = listMarkerService;
    }

    /**
     * Finds every list in a range of lines.
     *
     * @param request lines, optional range and settings
     * @return lists with their classified lines
     */
    @PostMapping(value = "/parse",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ParseListsResponse parse(@RequestBody ParseListsRequest request) {
        List<String> lines = requireLines(request.lines());
        int from = request.from() == null ? 0 : request.from();
        int to = request.to() == null ? lines.size() : request.to();
        MarkerSettings settings = resolveSettings(request.settings());

        List<ParsedList> lists = listMarkerService.parse(lines, from, to, settings);
        return new ParseListsResponse(lists.stream()
                .map(list -> ParsedListView.of(list, line -> listMarkerService.valueOf(line, settings)))
                .toList());
    }

    /**
     * Returns the list holding a line.
     *
     * @param request lines, target line and settings
     * @return the list, or {@code found=false}
     */
    @PostMapping(value = "/find",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public FindListResponse find(@RequestBody FindListRequest request) {
        List<String> lines = requireLines(request.lines());
        int lineNumber = requireLine(request.line(), lines);
        MarkerSettings settings = resolveSettings(request.settings());

        Optional<ParsedList> list = listMarkerService.findListContaining(lines, lineNumber, settings);
        return list
                .map(found -> new FindListResponse(true,
                        ParsedListView.of(found, line -> listMarkerService.valueOf(line, settings))))
                .orElseGet(() -> new FindListResponse(false, null));
    }

    /**
     * Enter: splits the line at the column and continues the list on the new line.
     */
    @PostMapping(value = "/continue",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ListEditResponse continueList(@RequestBody ListEditRequest request) {
        List<String> lines = requireLines(request.lines());
        int lineNumber = requireLine(request.line(), lines);
        int column = request.column() == null ? lines.get(lineNumber).length() : request.column();
        if (column < 0) {
            throw new IllegalArgumentException("column must not be negative");
        }
        ListEditOutcome outcome = listMarkerService.continueList(lines, lineNumber, column,
                resolveSettings(request.settings()));
        return ListEditResponse.of(outcome, lines);
    }

    /**
     * Tab: moves the line one level deeper.
     */
    @PostMapping(value = "/indent",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ListEditResponse indent(@RequestBody ListEditRequest request) {
        List<String> lines = requireLines(request.lines());
        int lineNumber = requireLine(request.line(), lines);
        ListEditOutcome outcome = listMarkerService.indent(lines, lineNumber, resolveSettings(request.settings()));
        return ListEditResponse.of(outcome, lines);
    }

    /**
     * Shift-Tab: moves the line one level up.
     */
    @PostMapping(value = "/outdent",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ListEditResponse outdent(@RequestBody ListEditRequest request) {
        List<String> lines = requireLines(request.lines());
        int lineNumber = requireLine(request.line(), lines);
        ListEditOutcome outcome = listMarkerService.outdent(lines, lineNumber, resolveSettings(request.settings()));
        return ListEditResponse.of(outcome, lines);
    }

    @PostMapping(value = "/edit",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ListEditResponse editContent(@RequestBody ListEditRequest request) {
        List<String> lines = requireLines(request.lines());
        int lineNumber = requireLine(request.line(), lines);
        if (request.content() == null) {
            throw new IllegalArgumentException("content is required");
        }
        ListEditOutcome outcome = listMarkerService.editContent(lines, lineNumber, request.content(),
                resolveSettings(request.settings()));
        return ListEditResponse.of(outcome, lines);
    }

    @PostMapping(value = "/remove",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ListEditResponse removeLine(@RequestBody ListEditRequest request) {
        List<String> lines = requireLines(request.lines());
        int lineNumber = requireLine(request.line(), lines);
        ListEditOutcome outcome = listMarkerService.removeLine(lines, lineNumber,
                resolveSettings(request.settings()));
        return ListEditResponse.of(outcome, lines);
    }

    /**
     * Retrieves statistics about the compiled grammar cache.
     *
     * @return hit count, miss count, evictions, size and hit rate
     */
    @GetMapping("/grammar/cache/stats")
    public ResponseEntity<Map<String, Object>> getCacheStats() {
        var stats = listMarkerService.getCacheStats();
        return ResponseEntity.ok(Map.of(
            "hitCount", stats.hitCount(),
            "missCount", stats.missCount(),
            "evictionCount", stats.evictionCount(),
            "size", stats.size(),
            "hitRate", String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100)
        ));
    }

    @PostMapping("/grammar/cache/clear")
    public ResponseEntity<ApiResponse> clearCache() {
        listMarkerService.clearCache();
        logger.info("List grammar cache cleared via API");
        return createSuccessResponse("Cache cleared successfully");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException e) {
        return super.handleValidationException(e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse> handleUnreadableRequest(HttpMessageNotReadableException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse> handleUnexpectedFailure(IllegalStateException e) {
        logger.error("List request failed", e);
        return handleServiceException(e, "process list request");
    }

    private MarkerSettings resolveSettings(MarkerSettingsOverride override) {
        MarkerSettings defaults = listMarkerService.getDefaultSettings();
        return override == null ? defaults : override.applyTo(defaults);
    }

    private static List<String> requireLines(List<String> lines) {
        if (lines == null) {
            throw new IllegalArgumentException("lines is required");
        }
        for (String line : lines) {
            if (line == null) {
                throw new IllegalArgumentException("lines must not contain null entries");
            }
            if (line.indexOf('\n') >= 0 || line.indexOf('\r') >= 0) {
                throw new IllegalArgumentException("lines must not contain line terminators");
            }
        }
        return lines;
    }

    private static int requireLine(Integer line, List<String> lines) {
        if (line == null) {
            throw new IllegalArgumentException("line is required");
        }
        if (line < 0 || line >= lines.size()) {
            throw new IllegalArgumentException(
                    "line must be between 0 and " + (lines.size() - 1) + " but was " + line);
        }
        return line;
    }
}
