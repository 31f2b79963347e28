package com.queryhub.api.web;

import com.queryhub.domain.model.CredentialAccess;
import com.queryhub.domain.model.IssuedBy;
import lombok.Value;

/**
 * Caller identity resolved once per request.
 */
@Value
public class CallerContext {

    String workspaceId;
    IssuedBy issuedBy;

    public CredentialAccess access() {
        return CredentialAccess.forCaller(workspaceId, issuedBy);
    }
}
