package com.example.authservice.web;

import com.example.authservice.gate.AuthGates;
import com.example.authservice.gate.Gate;
import com.example.authservice.gate.GatePipeline;
import com.example.authservice.gate.GateRejection;
import com.example.authservice.gate.GateResult;
import com.example.authservice.gate.RequestContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the gate pipeline declared on a handler before the handler executes.
 *
 * Flow:
 * HTTP Request → RequestIdFilter → GateInterceptor (gates) → Controller
 *
 * Method annotations take precedence over class annotations. Handlers without
 * gate annotations are public.
 */
@Slf4j
@RequiredArgsConstructor
public class GateInterceptor implements HandlerInterceptor {

    public static final String PRINCIPAL_ATTRIBUTE = GateInterceptor.class.getName() + ".principal";

    private final AuthGates authGates;
    private final ObjectMapper objectMapper;

    private final Map<Method, GatePipeline> pipelines = new ConcurrentHashMap<>();

    @Override
    public boolean preHandle(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull Object handler) throws IOException {

        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        GatePipeline pipeline = pipelines.computeIfAbsent(handlerMethod.getMethod(),
                method -> buildPipeline(handlerMethod));
        if (pipeline.isEmpty()) {
            return true;
        }

        RequestContext context = RequestContext.of(
                RequestIdFilter.requestIdOf(request),
                request.getHeader(HttpHeaders.AUTHORIZATION));
        GateResult result = pipeline.run(context);

        if (result.isTerminated()) {
            writeRejection(response, result.getRejection().orElseThrow());
            return false;
        }

        result.getContext()
                .flatMap(RequestContext::getPrincipal)
                .ifPresent(principal -> request.setAttribute(PRINCIPAL_ATTRIBUTE, principal));
        return true;
    }

    private GatePipeline buildPipeline(HandlerMethod handlerMethod) {
        List<Gate> gates = new ArrayList<>();

        RequireRole requireRole = findAnnotation(handlerMethod, RequireRole.class);
        if (requireRole != null) {
            gates.add(authGates.authenticate());
            gates.add(authGates.requireRole(requireRole.value()));
        } else if (findAnnotation(handlerMethod, Authenticated.class) != null) {
            gates.add(authGates.authenticate());
        } else if (findAnnotation(handlerMethod, OptionalAuthentication.class) != null) {
            gates.add(authGates.authenticateOptional());
        }

        log.debug("Gate pipeline for {}: {} gate(s)", handlerMethod.getShortLogMessage(), gates.size());
        return GatePipeline.of(gates);
    }

    private static <A extends Annotation> A findAnnotation(
            HandlerMethod handlerMethod, Class<A> type) {
        A onMethod = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), type);
        if (onMethod != null) {
            return onMethod;
        }
        if (hasAnyGateAnnotation(handlerMethod)) {
            return null;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), type);
    }

    private static boolean hasAnyGateAnnotation(HandlerMethod handlerMethod) {
        Method method = handlerMethod.getMethod();
        return AnnotatedElementUtils.hasAnnotation(method, RequireRole.class)
                || AnnotatedElementUtils.hasAnnotation(method, Authenticated.class)
                || AnnotatedElementUtils.hasAnnotation(method, OptionalAuthentication.class);
    }

    private void writeRejection(HttpServletResponse response, GateRejection rejection) throws IOException {
        response.setStatus(rejection.status().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), rejection.body());
    }
}
