package com.homesplit.service;

import com.homesplit.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Service;

/** Verifies bearer tokens minted by the identity service, which shares the HMAC secret. */
@Service
public class JwtService {
  private static final int MIN_SECRET_BYTES = 32;

  private final JwtProperties properties;
  private final SecretKey key;

  public JwtService(JwtProperties properties) {
    if (properties.secret() == null
        || properties.secret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalStateException("homesplit.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    this.properties = properties;
    this.key = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
  }

  public UUID parseUserId(String token) {
    JwtParserBuilder parser = Jwts.parserBuilder().setSigningKey(key);
    if (properties.issuer() != null && !properties.issuer().isBlank()) {
      parser.requireIssuer(properties.issuer());
    }
    Claims claims = parser.build().parseClaimsJws(token).getBody();
    return UUID.fromString(claims.getSubject());
  }
}
