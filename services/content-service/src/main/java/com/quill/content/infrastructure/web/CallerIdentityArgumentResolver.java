package com.quill.content.infrastructure.web;

import com.quill.content.domain.ContentException;
import com.quill.security.CallerIdentity;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies the {@link CallerIdentity} established by {@link AuthGateFilter} to controller methods
 * that declare it as a parameter.
 *
 * <p>A handler asking for a caller on a route the gate does not cover gets a 401 rather than a
 * null.
 */
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    /** Request attribute holding the authenticated caller. */
    public static final String CALLER_ATTRIBUTE = CallerIdentity.class.getName();

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        Object caller = webRequest.getAttribute(CALLER_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (caller instanceof CallerIdentity identity) {
            return identity;
        }
        throw ContentException.unauthenticated(AuthGateFilter.REJECTION_MESSAGE);
    }
}
