package com.eduhub.learning_backend.common.security;

import com.eduhub.learning_backend.common.api.ApiResponse;
import com.eduhub.learning_backend.common.trace.TraceIdHolder;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * Helper for capturing and rendering authentication-related error responses.
 */
public final class AuthProblemSupport {

    public static final String AUTH_ERROR_CONTEXT_ATTR = AuthProblemSupport.class.getName() + ".CONTEXT";

    private AuthProblemSupport() {
    }

    public static void flag(HttpServletRequest request, AuthErrorType type, @Nullable String detail, @Nullable Map<String, String> errors) {
        if (request.getAttribute(AUTH_ERROR_CONTEXT_ATTR) == null) {
            request.setAttribute(AUTH_ERROR_CONTEXT_ATTR, new AuthErrorContext(type, detail, errors));
        }
    }

    @Nullable
    public static AuthErrorContext get(HttpServletRequest request) {
        Object context = request.getAttribute(AUTH_ERROR_CONTEXT_ATTR);
        if (context instanceof AuthErrorContext authErrorContext) {
            return authErrorContext;
        }
        return null;
    }

    /**
     * 以 ApiResponse 形式输出鉴权/授权错误：message 为稳定机器码，displayMessage 为展示文案。
     * WWW-Authenticate 仅在 401 时返回。
     */
    public static void writeApiResponse(HttpServletResponse response, AuthErrorContext context,
                                        ObjectMapper mapper) throws IOException {
        if (response.isCommitted()) {
            return;
        }

        AuthErrorType type = context.type();
        int status = type.getStatus().value();
        String detail = StringUtils.hasText(context.detail()) ? context.detail() : type.getDefaultDetail();
        Map<String, String> errors = context.errors() != null ? context.errors() : Collections.emptyMap();
        String traceId = TraceIdHolder.require();

        response.setStatus(status);
        response.setContentType("application/json;charset=UTF-8");
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, traceId);
        if (status == 401) {
            response.setHeader("WWW-Authenticate", "Bearer error=\"" + type.getOauthError()
                    + "\", error_description=\"" + type.getDefaultDetail().replace("\"", "\\\"") + "\"");
        }

        ApiResponse<Void> body = ApiResponse.authError(status, type.getCode(), type.getDisplayMessage(), errors, detail);
        mapper.writeValue(response.getOutputStream(), body);
    }
}
