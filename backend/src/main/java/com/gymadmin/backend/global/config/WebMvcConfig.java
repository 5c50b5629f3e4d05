package com.gymadmin.backend.global.config;

import com.gymadmin.backend.modules.access.presentation.AccessControlInterceptor;
import com.gymadmin.backend.modules.audit.presentation.AuditInterceptor;
import com.gymadmin.backend.modules.staff.presentation.PinStepUpInterceptor;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final AccessControlInterceptor accessControlInterceptor;
    private final PinStepUpInterceptor pinStepUpInterceptor;
    private final AuditInterceptor auditInterceptor;

    public WebMvcConfig(AccessControlInterceptor accessControlInterceptor, PinStepUpInterceptor pinStepUpInterceptor,
                        AuditInterceptor auditInterceptor) {
        this.accessControlInterceptor = accessControlInterceptor;
        this.pinStepUpInterceptor = pinStepUpInterceptor;
        this.auditInterceptor = auditInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(accessControlInterceptor);
        registry.addInterceptor(pinStepUpInterceptor);
        registry.addInterceptor(auditInterceptor);
    }
}
