package com.queryhub.domain.model;

import java.util.Objects;

/**
 * How a caller is allowed to read a workspace credential.
 *
 * SESSION is a human caller whose session is already scoped to the workspace.
 * ADMIN is a machine caller (agent secret, machine token) that bypasses the
 * session scope; the workspace filter is then enforced in code only.
 */
public final class CredentialAccess {

    public enum Mode {
        SESSION,
        ADMIN
    }

    private final Mode mode;
    private final String workspaceId;
    private final IssuedBy issuedBy;

    private CredentialAccess(Mode mode, String workspaceId, IssuedBy issuedBy) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId must not be empty");
        }
        this.mode = mode;
        this.workspaceId = workspaceId;
        this.issuedBy = issuedBy;
    }

    public static CredentialAccess session(String workspaceId) {
        return new CredentialAccess(Mode.SESSION, workspaceId, IssuedBy.USER);
    }

    public static CredentialAccess admin(String workspaceId, IssuedBy issuedBy) {
        return new CredentialAccess(Mode.ADMIN, workspaceId, issuedBy);
    }

    public static CredentialAccess forCaller(String workspaceId, IssuedBy issuedBy) {
        return issuedBy == IssuedBy.USER ? session(workspaceId) : admin(workspaceId, issuedBy);
    }

    public Mode getMode() {
        return mode;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public IssuedBy getIssuedBy() {
        return issuedBy;
    }

    public boolean isAdmin() {
        return mode == Mode.ADMIN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CredentialAccess)) {
            return false;
        }
        CredentialAccess that = (CredentialAccess) o;
        return mode == that.mode && workspaceId.equals(that.workspaceId) && issuedBy == that.issuedBy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, workspaceId, issuedBy);
    }

    @Override
    public String toString() {
        return mode + "(" + workspaceId + ")";
    }
}
