package com.gymadmin.backend.modules.staff.presentation;

import com.gymadmin.backend.global.web.ClientIpResolver;
import com.gymadmin.backend.modules.staff.domain.ClientContext;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;

final class ClientContexts {

    private ClientContexts() {
    }

    static ClientContext from(HttpServletRequest request) {
        return new ClientContext(ClientIpResolver.resolve(request), request.getHeader(HttpHeaders.USER_AGENT));
    }
}
