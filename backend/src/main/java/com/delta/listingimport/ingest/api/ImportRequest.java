package com.delta.listingimport.ingest.api;

import com.delta.listingimport.ingest.model.ImportSelection;

import java.util.List;

public record ImportRequest(
    List<ImportSelection> selections
) {
}
