package org.carball.sqlinspector.token;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.carball.sqlinspector.config.InspectorConfig;
import org.carball.sqlinspector.exception.InvalidTokenException;
import org.carball.sqlinspector.exception.NotReadOnlyException;
import org.carball.sqlinspector.model.query.QueryParameters;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Signs (statement, parameters) pairs into compact JWS tokens and opens them again.
 *
 * <p>The claims hold the statement, the binding style and every parameter as a
 * type name plus its text, so a verified token yields values equal to the signed
 * ones. Tokens carry {@link #DOMAIN_TAG} as their audience and are signed with a
 * key derived from the configured secret and the same tag, so a token never
 * verifies as any other JWT made with that secret.
 *
 * <p>Only read-only statements with at least one bound parameter are ever signed.
 * The read-only check is repeated on {@link #verify(String)}.
 */
@Slf4j
public class QueryTokenCodec {

    public static final String DOMAIN_TAG = "sql-inspector.query-token";

    static final String STATEMENT_CLAIM = "stmt";
    static final String BINDING_CLAIM = "binding";
    static final String PARAMETERS_CLAIM = "params";

    private static final String NAMED_BINDING = "named";
    private static final String POSITIONAL_BINDING = "positional";
    private static final String KEY_DERIVATION_ALGORITHM = "HmacSHA384";

    private final SecretKey signingKey;
    private final JwtParser parser;
    private final String readOnlyKeyword;

    public QueryTokenCodec(String secretKey, String readOnlyKeyword) {
        if (secretKey == null || secretKey.isEmpty()) {
            throw new IllegalArgumentException("Secret key must not be empty");
        }
        if (readOnlyKeyword == null || readOnlyKeyword.isBlank()) {
            throw new IllegalArgumentException("Read-only keyword must not be empty");
        }
        this.signingKey = deriveKey(secretKey);
        this.parser = Jwts.parser()
                .verifyWith(signingKey)
                .requireAudience(DOMAIN_TAG)
                .build();
        this.readOnlyKeyword = readOnlyKeyword.strip().toLowerCase(Locale.ROOT);
    }

    public QueryTokenCodec(InspectorConfig config) {
        this(config.getSecretKey(), config.getReadOnlyKeyword());
    }

    /**
     * Produces a token for the pair, or nothing if the statement may not be re-run:
     * no parameters, not read-only, or a parameter of a type tokens cannot carry.
     */
    public Optional<String> sign(String statement, QueryParameters parameters) {
        if (parameters == null || parameters.isEmpty() || !isReadOnly(statement)) {
            return Optional.empty();
        }

        List<Map<String, Object>> encoded = new ArrayList<>(parameters.size());
        if (parameters.isNamed()) {
            for (Map.Entry<String, Object> entry : parameters.getNamed().entrySet()) {
                Optional<Map<String, Object>> value = encode(entry.getValue());
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                value.get().put("name", entry.getKey());
                encoded.add(value.get());
            }
        } else {
            for (Object parameter : parameters.getPositional()) {
                Optional<Map<String, Object>> value = encode(parameter);
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                encoded.add(value.get());
            }
        }

        String token = Jwts.builder()
                .audience().add(DOMAIN_TAG).and()
                .claim(STATEMENT_CLAIM, statement)
                .claim(BINDING_CLAIM, parameters.isNamed() ? NAMED_BINDING : POSITIONAL_BINDING)
                .claim(PARAMETERS_CLAIM, encoded)
                .signWith(signingKey)
                .compact();
        return Optional.of(token);
    }

    /**
     * Checks the signature and the read-only policy, returning the original pair.
     *
     * @throws InvalidTokenException if the token is missing, malformed or not signed by us
     * @throws NotReadOnlyException  if the signed statement no longer passes the read-only check
     */
    public VerifiedQuery verify(String token) {
        if (token == null || token.isBlank()) {
            throw reject("Missing query token");
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected query token: {}", e.getMessage());
            throw new InvalidTokenException("Query token failed signature verification", e);
        }

        Object statement = claims.get(STATEMENT_CLAIM);
        Object binding = claims.get(BINDING_CLAIM);
        Object encoded = claims.get(PARAMETERS_CLAIM);
        if (!(statement instanceof String) || !(encoded instanceof List)
                || !(NAMED_BINDING.equals(binding) || POSITIONAL_BINDING.equals(binding))) {
            throw reject("Query token payload has an unexpected shape");
        }

        if (!isReadOnly((String) statement)) {
            log.warn("Rejected signed statement that is not read-only");
            throw new NotReadOnlyException(readOnlyKeyword);
        }

        QueryParameters parameters = decode((List<?>) encoded, NAMED_BINDING.equals(binding));
        return new VerifiedQuery((String) statement, parameters);
    }

    /**
     * Whether the statement, trimmed and lower-cased, starts with the read-only keyword.
     */
    public boolean isReadOnly(String statement) {
        return statement != null && statement.strip().toLowerCase(Locale.ROOT).startsWith(readOnlyKeyword);
    }

    public String getReadOnlyKeyword() {
        return readOnlyKeyword;
    }

    private static Optional<Map<String, Object>> encode(Object value) {
        Optional<ParameterType> type = ParameterType.of(value);
        if (type.isEmpty()) {
            log.debug("Not signing statement with {} parameter", value.getClass().getSimpleName());
            return Optional.empty();
        }
        Map<String, Object> encoded = new LinkedHashMap<>();
        encoded.put("type", type.get().name());
        if (value != null) {
            encoded.put("value", type.get().encode(value));
        }
        return Optional.of(encoded);
    }

    private static QueryParameters decode(List<?> encoded, boolean named) {
        List<Object> positional = new ArrayList<>(encoded.size());
        Map<String, Object> byName = new LinkedHashMap<>();

        for (Object item : encoded) {
            if (!(item instanceof Map)) {
                throw reject("Query token parameter is not an object");
            }
            Map<?, ?> entry = (Map<?, ?>) item;
            Object value;
            try {
                ParameterType type = ParameterType.valueOf(String.valueOf(entry.get("type")));
                Object text = entry.get("value");
                value = type.decode(text == null ? null : text.toString());
            } catch (IllegalArgumentException e) {
                throw new InvalidTokenException("Query token parameter cannot be decoded", e);
            }

            if (named) {
                Object name = entry.get("name");
                if (!(name instanceof String)) {
                    throw reject("Query token parameter has no name");
                }
                byName.put((String) name, value);
            } else {
                positional.add(value);
            }
        }
        return named ? QueryParameters.named(byName) : QueryParameters.positional(positional);
    }

    private static InvalidTokenException reject(String reason) {
        log.warn("Rejected query token: {}", reason);
        return new InvalidTokenException(reason);
    }

    /**
     * HMAC-SHA384 of the domain tag under the secret. The 384-bit result selects HS384,
     * whose signature fills its base64url text exactly.
     */
    static SecretKey deriveKey(String secretKey) {
        try {
            Mac mac = Mac.getInstance(KEY_DERIVATION_ALGORITHM);
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), KEY_DERIVATION_ALGORITHM));
            return Keys.hmacShaKeyFor(mac.doFinal(DOMAIN_TAG.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException(KEY_DERIVATION_ALGORITHM + " is not available", e);
        }
    }
}
