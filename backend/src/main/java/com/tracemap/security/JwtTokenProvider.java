package com.tracemap.security;

import java.nio.charset.StandardCharsets;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;

@Component
public class JwtTokenProvider {

    private final byte[] signingKey;

    public JwtTokenProvider(@Value("${app.jwt.secret:}") String secret) {
        this.signingKey = secret.getBytes(StandardCharsets.UTF_8);
    }

    public Claims extractClaims(String token) throws JwtException {
        return Jwts.parserBuilder()
            .setSigningKey(signingKey)
            .build()
            .parseClaimsJws(token)
            .getBody();
    }

    public String extractSubject(String token) throws JwtException {
        return extractClaims(token).getSubject();
    }

    public boolean isValid(String token) {
        if (signingKey.length == 0) {
            return false;
        }
        try {
            extractClaims(token);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }
}
