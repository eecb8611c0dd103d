package com.attest.security;

/** Thrown when the subject's effective permission set does not grant the required permission. */
public class PermissionDeniedException extends AuthException {

    private final String subjectId;
    private final PermissionCode required;

    public PermissionDeniedException(String subjectId, PermissionCode required) {
        super(AuthFailure.PERMISSION_DENIED,
                "Subject '%s' lacks permission '%s'".formatted(subjectId, required.value()));
        this.subjectId = subjectId;
        this.required = required;
    }

    public String subjectId() {
        return subjectId;
    }

    public PermissionCode required() {
        return required;
    }
}
