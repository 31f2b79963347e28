package com.queryhub.domain.model;

import lombok.Value;

@Value
public class CountResult {

    long count;
    CountSource source;

    /** Pages fetched by the fallback path, 0 for the primary path. */
    int pagesFetched;

    public static CountResult primary(long count) {
        return new CountResult(count, CountSource.PRIMARY, 0);
    }

    public boolean isPartial() {
        return source == CountSource.FALLBACK_PARTIAL;
    }
}
