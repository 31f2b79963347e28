package com.queryhub.domain.model;

import com.queryhub.domain.service.EnumerationSource;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Enumeration strategy used to count matching items when the aggregate query
 * fails or gives no usable answer.
 */
@Value
@Builder
public class CountFallback {

    EnumerationSource source;

    /** Applied to every enumerated item; matches are counted. */
    Predicate<Map<String, Object>> predicate;

    @Builder.Default
    String countColumn = "count";
}
