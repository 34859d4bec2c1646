package io.hypha.core.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.hypha.core.internal.Json;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Compact JWS tokens signed with HMAC-SHA256.
 *
 * <p>
 * A token is {@code base64url(header) + "." + base64url(claims) + "." + base64url(signature)} with
 * unpadded base64url segments and header {@code {"alg":"HS256","typ":"JWT"}}.
 * </p>
 */
public final class JwtHs256 {

    private static final String ALGORITHM = "HS256";
    private static final String HMAC = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private JwtHs256() {
    }

    public static String generate(TokenClaims claims, String secret) {
        Objects.requireNonNull(claims, "claims");
        Objects.requireNonNull(secret, "secret");
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", ALGORITHM);
        header.put("typ", "JWT");
        String signingInput = encode(Json.write(header)) + "." + encode(Json.write(claims.toJsonMap()));
        byte[] signature = hmacSha256(signingInput, secret);
        return signingInput + "." + ENCODER.encodeToString(signature);
    }

    public static TokenClaims verify(String token, String secret) throws TokenVerificationException {
        return verify(token, secret, Clock.systemUTC());
    }

    /**
     * Checks shape, header, signature and expiry, in that order.
     *
     * @throws TokenFormatException    when the token is not three decodable segments with an HS256 header
     * @throws TokenSignatureException when the signature does not match {@code secret}
     * @throws TokenExpiredException   when {@code exp} lies before the clock's current second
     */
    public static TokenClaims verify(String token, String secret, Clock clock) throws TokenVerificationException {
        Objects.requireNonNull(secret, "secret");
        Objects.requireNonNull(clock, "clock");
        if (token == null) {
            throw new TokenFormatException("Invalid JWT format");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new TokenFormatException("Invalid JWT format");
        }

        JsonNode header = decodeJson(parts[0], "header");
        if (!ALGORITHM.equals(header.path("alg").asText())) {
            throw new TokenFormatException("Unsupported algorithm: " + header.path("alg").asText());
        }

        byte[] expected = hmacSha256(parts[0] + "." + parts[1], secret);
        byte[] actual;
        try {
            actual = DECODER.decode(parts[2]);
        } catch (IllegalArgumentException ex) {
            throw new TokenFormatException("Invalid JWT signature encoding", ex);
        }
        if (!constantTimeEquals(expected, actual)) {
            throw new TokenSignatureException("Invalid signature");
        }

        TokenClaims claims = TokenClaims.fromJson(decodeJson(parts[1], "claims"));
        long nowSeconds = clock.instant().getEpochSecond();
        if (claims.exp() != null && nowSeconds > claims.exp()) {
            throw new TokenExpiredException(claims.exp());
        }
        return claims;
    }

    static boolean constantTimeEquals(byte[] expected, byte[] actual) {
        if (expected.length != actual.length) {
            return false;
        }
        int diff = 0;
        for (int i = 0; i < expected.length; i++) {
            diff |= expected[i] ^ actual[i];
        }
        return diff == 0;
    }

    private static JsonNode decodeJson(String segment, String label) throws TokenFormatException {
        try {
            JsonNode node = Json.mapper().readTree(DECODER.decode(segment));
            if (node == null || !node.isObject()) {
                throw new TokenFormatException("JWT " + label + " is not a JSON object");
            }
            return node;
        } catch (IllegalArgumentException | IOException ex) {
            throw new TokenFormatException("Invalid JWT " + label + ": " + ex.getMessage(), ex);
        }
    }

    private static String encode(String json) {
        return ENCODER.encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] hmacSha256(String message, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }
}
