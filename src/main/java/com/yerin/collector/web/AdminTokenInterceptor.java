package com.yerin.collector.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.collector.global.dto.ErrorResponse;
import com.yerin.collector.global.exception.code.CommonErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;

@Component
public class AdminTokenInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-Admin-Token";

    private static final ObjectMapper om = new ObjectMapper().findAndRegisterModules();

    private final String adminToken;

    public AdminTokenInterceptor(@Value("${collector.admin.token:}") String adminToken) {
        this.adminToken = adminToken;
    }

    /** 토큰이 설정되지 않았으면 관리자 API 는 모두 막힌다. */
    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        String token = request.getHeader(HEADER);
        if (adminToken != null && !adminToken.isBlank() && adminToken.equals(token)) {
            return true;
        }
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(om.writeValueAsString(ErrorResponse.of(CommonErrorCode.UNAUTHORIZED, request)));
        return false;
    }
}
