package com.williamcallahan.orderedlists.web;

import java.util.List;

/**
 * Request body for list parsing.
 *
 * @param lines document lines
 * @param from first line to scan, defaults to 0
 * @param to line after the last one to scan, defaults to the line count
 * @param settings optional settings changes
 */
public record ParseListsRequest(
    List<String> lines,
    Integer from,
    Integer to,
    MarkerSettingsOverride settings
) {}
