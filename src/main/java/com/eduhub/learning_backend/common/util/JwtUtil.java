package com.eduhub.learning_backend.common.util;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * 访问令牌由外部认证服务签发（HS256，共享密钥），本服务只负责校验与解析。
 * {@link #generateAccessToken} 仅供运维脚本与测试使用。
 */
@Component
public class JwtUtil {

    public static final String CLAIM_TYP = "typ";
    public static final String CLAIM_UID = "uid";
    public static final String CLAIM_ROLE = "role";
    public static final String TOKEN_TYPE_ACCESS = "access";

    @Value("${security.jwt.secret}")
    private String secret;

    @Value("${security.jwt.access-token-expire:3600}")
    private long accessTokenExpire;  // seconds

    private Key key;

    @PostConstruct
    public void init() {
        // 保证 secret 至少 32 bytes，HS256 可用
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public Claims parseClaims(String token) throws JwtException {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token).getBody();
    }

    public String generateAccessToken(String userId, String username, String role) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(CLAIM_TYP, TOKEN_TYPE_ACCESS);
        claims.put(CLAIM_UID, userId);
        claims.put(CLAIM_ROLE, role);
        Date now = new Date();
        return Jwts.builder()
                .setClaims(claims)
                .setSubject(username)
                .setIssuedAt(now)
                .setExpiration(new Date(now.getTime() + accessTokenExpire * 1000))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }
}
