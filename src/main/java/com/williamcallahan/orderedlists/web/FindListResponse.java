package com.williamcallahan.orderedlists.web;

/**
 * Response for the find endpoint.
 *
 * @param found whether the line belongs to a list
 * @param list the list, or {@code null}
 */
public record FindListResponse(boolean found, ParsedListView list) {}
