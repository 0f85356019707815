package com.example.admission.ratelimiter.filter;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.server.RequestPath;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerExecutionChain;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.util.ServletRequestPathUtils;

/**
 * Spring MVC 핸들러 매핑으로 엔드포인트 이름을 찾는 기본 구현
 *
 * 1. 매핑 어노테이션의 name 속성 (예: {@code @PostMapping(value = "/login", name = "login")})
 * 2. 없으면 핸들러 메서드 이름
 *
 * 필터는 DispatcherServlet 보다 먼저 실행되므로 경로 파싱 결과를 직접 만들고, 끝나면 원래대로 되돌립니다.
 */
@Slf4j
@Component
public class HandlerMappingEndpointNameResolver implements EndpointNameResolver {

    private final RequestMappingHandlerMapping handlerMapping;

    public HandlerMappingEndpointNameResolver(
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping) {
        this.handlerMapping = handlerMapping;
    }

    @Override
    @Nullable
    public String resolve(HttpServletRequest request) {
        RequestPath previous = ServletRequestPathUtils.hasParsedRequestPath(request)
                ? ServletRequestPathUtils.getParsedRequestPath(request)
                : null;
        ServletRequestPathUtils.parseAndCache(request);
        try {
            HandlerExecutionChain chain = handlerMapping.getHandler(request);
            if (chain == null || !(chain.getHandler() instanceof HandlerMethod)) {
                return null;
            }
            return nameOf((HandlerMethod) chain.getHandler());
        } catch (Exception e) {
            log.debug("Could not resolve endpoint name for {}: {}", request.getRequestURI(), e.getMessage());
            return null;
        } finally {
            ServletRequestPathUtils.setParsedRequestPath(previous, request);
        }
    }

    static String nameOf(HandlerMethod handlerMethod) {
        RequestMapping mapping = AnnotatedElementUtils.findMergedAnnotation(
                handlerMethod.getMethod(), RequestMapping.class);
        if (mapping != null && StringUtils.hasText(mapping.name())) {
            return mapping.name();
        }
        return handlerMethod.getMethod().getName();
    }
}
