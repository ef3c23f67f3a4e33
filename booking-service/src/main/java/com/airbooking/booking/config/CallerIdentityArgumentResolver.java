package com.airbooking.booking.config;

import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.service.identity.IdentityProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Authenticates the request whenever a handler declares a {@link CallerIdentity} parameter.
 */
@Component
@RequiredArgsConstructor
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    private final IdentityProvider identityProvider;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return identityProvider.authenticate(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
    }
}
