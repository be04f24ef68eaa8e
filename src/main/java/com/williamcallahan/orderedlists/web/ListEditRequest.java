package com.williamcallahan.orderedlists.web;

import java.util.List;

/**
 * Request body shared by the editing endpoints.
 *
 * @param lines document lines
 * @param line line the edit applies to
 * @param column cursor column for {@code /continue}, defaults to the end of the line
 * @param content new content for {@code /edit}
 * @param settings optional settings changes
 */
public record ListEditRequest(
    List<String> lines,
    Integer line,
    Integer column,
    String content,
    MarkerSettingsOverride settings
) {}
