package com.williamcallahan.orderedlists.web;

import java.util.List;

/**
 * Request body for locating the list around a line.
 *
 * @param lines document lines
 * @param line target line index
 * @param settings optional settings changes
 */
public record FindListRequest(
    List<String> lines,
    Integer line,
    MarkerSettingsOverride settings
) {}
