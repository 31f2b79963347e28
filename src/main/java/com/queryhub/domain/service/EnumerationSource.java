package com.queryhub.domain.service;

import com.queryhub.domain.model.EnumerationPage;
import com.queryhub.domain.model.WorkspaceCredential;
import reactor.core.publisher.Mono;

/**
 * Paginated item source used by the count fallback.
 */
@FunctionalInterface
public interface EnumerationSource {

    Mono<EnumerationPage> fetchPage(WorkspaceCredential credential, String cursor, int pageSize);
}
