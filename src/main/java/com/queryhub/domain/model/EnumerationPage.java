package com.queryhub.domain.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One page of an enumeration endpoint. {@code nextCursor} is null on the last page.
 */
@Value
public class EnumerationPage {

    List<Map<String, Object>> items;
    String nextCursor;

    public boolean hasMore() {
        return nextCursor != null && !nextCursor.isBlank();
    }
}
