package com.gymadmin.backend.modules.access.presentation;

/**
 * Request body that names the branch it acts on. Used when the branch id is neither a path variable nor a query
 * parameter.
 */
public interface BranchScopedRequest {

    String branchId();
}
