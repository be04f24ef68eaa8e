package com.williamcallahan.orderedlists.web;

import java.util.List;

/**
 * Response for the parse endpoint.
 *
 * @param lists lists found, in document order
 */
public record ParseListsResponse(List<ParsedListView> lists) {}
