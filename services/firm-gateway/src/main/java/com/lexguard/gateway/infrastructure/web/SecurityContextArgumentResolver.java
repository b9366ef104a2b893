package com.lexguard.gateway.infrastructure.web;

import com.lexguard.security.LexguardSecurityContext;
import com.lexguard.security.SecurityContextFactory;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies a {@link LexguardSecurityContext} to controller methods that declare one.
 *
 * <p>The context is resolved once per request and cached as a request attribute. Resolution
 * failures propagate as {@link com.lexguard.security.TenantSecurityException} and are rendered by
 * {@link GlobalExceptionHandler}.
 */
public class SecurityContextArgumentResolver implements HandlerMethodArgumentResolver {

    static final String ATTRIBUTE = LexguardSecurityContext.class.getName();

    private final SecurityContextFactory factory;

    public SecurityContextArgumentResolver(SecurityContextFactory factory) {
        this.factory = factory;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return LexguardSecurityContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        Object cached = webRequest.getAttribute(ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (cached instanceof LexguardSecurityContext context) {
            return context;
        }
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request == null) {
            throw new IllegalStateException("Security context requires a servlet request");
        }
        LexguardSecurityContext context = factory.create(ActorHeaders.identityOf(request));
        webRequest.setAttribute(ATTRIBUTE, context, RequestAttributes.SCOPE_REQUEST);
        return context;
    }
}
