package com.delta.listingimport.ingest.external;

public record LocationQuery(String city, String state, String zip) {
    public boolean hasZip() {
        return zip != null && !zip.isBlank();
    }

    /**
     * Value for the {@code cityOrZip} search argument.
     */
    public String cityOrZip() {
        return hasZip() ? zip : city;
    }
}
