package com.eduhub.learning_backend.common.util;

import com.eduhub.learning_backend.common.security.AuthErrorType;
import com.eduhub.learning_backend.common.security.AuthProblemSupport;
import com.eduhub.learning_backend.common.security.CustomUserDetails;
import com.eduhub.learning_backend.modules.users.entity.User;
import com.eduhub.learning_backend.modules.users.mapper.UserMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;

@Component
public class JwtFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private final JwtUtil jwtUtil;
    private final UserMapper userMapper;

    public JwtFilter(JwtUtil jwtUtil, UserMapper userMapper) {
        this.jwtUtil = jwtUtil;
        this.userMapper = userMapper;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            processAuthentication(request);
        }

        filterChain.doFilter(request, response);
    }

    private void processAuthentication(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        // 无 Authorization 头直接放行，由后续过滤器决定接口是否需要认证
        if (!StringUtils.hasText(authHeader)) {
            return;
        }

        if (!authHeader.startsWith(BEARER)) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.BAD_AUTHORIZATION_HEADER,
                    "Malformed Authorization header",
                    Map.of("Authorization", "Expected 'Authorization: Bearer <token>' format")
            );
            return;
        }

        String token = authHeader.substring(BEARER.length()).trim();
        if (!StringUtils.hasText(token)) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.BAD_AUTHORIZATION_HEADER,
                    "Missing bearer token",
                    Map.of("Authorization", "Bearer token value is missing")
            );
            return;
        }

        try {
            Claims claims = jwtUtil.parseClaims(token);

            String tokenType = claims.get(JwtUtil.CLAIM_TYP, String.class);
            if (StringUtils.hasText(tokenType) && !JwtUtil.TOKEN_TYPE_ACCESS.equalsIgnoreCase(tokenType)) {
                AuthProblemSupport.flag(
                        request,
                        AuthErrorType.INVALID_TOKEN,
                        "Wrong token type: " + tokenType,
                        Map.of("token", "wrong_type")
                );
                return;
            }

            String uid = claims.get(JwtUtil.CLAIM_UID, String.class);
            if (!StringUtils.hasText(uid)) {
                AuthProblemSupport.flag(
                        request,
                        AuthErrorType.CLAIM_MISMATCH,
                        "Missing uid claim",
                        Map.of("token", "uid_missing")
                );
                return;
            }

            User user = userMapper.selectById(uid).orElse(null);
            if (user == null || !user.isActive()) {
                AuthProblemSupport.flag(
                        request,
                        AuthErrorType.CLAIM_MISMATCH,
                        user == null ? "Subject not found" : "User is disabled",
                        Map.of("token", user == null ? "unknown_uid" : "user_disabled")
                );
                return;
            }

            CustomUserDetails userDetails = new CustomUserDetails(user);
            UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                    userDetails, null, userDetails.getAuthorities());
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authToken);
        } catch (ExpiredJwtException e) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.TOKEN_EXPIRED,
                    "The bearer token is expired at " + e.getClaims().getExpiration(),
                    Map.of("token", "expired")
            );
        } catch (JwtException | IllegalArgumentException e) {
            AuthProblemSupport.flag(
                    request,
                    AuthErrorType.INVALID_TOKEN,
                    "Invalid token: " + e.getMessage(),
                    Map.of("token", "invalid")
            );
        }
    }
}
