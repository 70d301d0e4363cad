package com.delta.listingimport.ingest.api;

import java.util.List;

public record AddUrlsRequest(
    List<String> urls
) {
}
