package in.dcabot.infrastructure.venue.coinbase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.dcabot.infrastructure.venue.VenueAuthenticationException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.time.Clock;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Signs Coinbase Advanced Trade requests with a short-lived ES256 JWT.
 *
 * The CDP API secret is an EC P-256 key in PEM form, either SEC1
 * ("BEGIN EC PRIVATE KEY") or PKCS#8 ("BEGIN PRIVATE KEY"). A new token is
 * minted for every request; each is bound to one method and path.
 */
public final class CoinbaseJwtSigner implements RequestAuthenticator {

    private static final long TOKEN_LIFETIME_SECONDS = 120;
    private static final String ISSUER = "cdp";

    // AlgorithmIdentifier { id-ecPublicKey, prime256v1 }
    private static final byte[] EC_P256_ALGORITHM_ID = {
        0x30, 0x13,
        0x06, 0x07, 0x2A, (byte) 0x86, 0x48, (byte) 0xCE, 0x3D, 0x02, 0x01,
        0x06, 0x08, 0x2A, (byte) 0x86, 0x48, (byte) 0xCE, 0x3D, 0x03, 0x01, 0x07
    };

    private final String keyName;
    private final PrivateKey privateKey;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SecureRandom random = new SecureRandom();

    public CoinbaseJwtSigner(String keyName, String privateKeyPem) {
        this(keyName, privateKeyPem, Clock.systemUTC());
    }

    public CoinbaseJwtSigner(String keyName, String privateKeyPem, Clock clock) {
        if (keyName == null || keyName.isBlank()) {
            throw new VenueAuthenticationException("COINBASE", "configure", "API key name is missing");
        }
        this.keyName = keyName;
        this.privateKey = parsePrivateKey(privateKeyPem);
        this.clock = clock;
    }

    @Override
    public String bearerToken(String method, String host, String path) {
        long now = clock.instant().getEpochSecond();

        ObjectNode header = objectMapper.createObjectNode();
        header.put("alg", "ES256");
        header.put("kid", keyName);
        header.put("nonce", nonce());
        header.put("typ", "JWT");

        ObjectNode claims = objectMapper.createObjectNode();
        claims.put("sub", keyName);
        claims.put("iss", ISSUER);
        claims.put("nbf", now);
        claims.put("exp", now + TOKEN_LIFETIME_SECONDS);
        claims.put("uri", method + " " + host + path);

        try {
            String signingInput = base64Url(objectMapper.writeValueAsBytes(header))
                + "." + base64Url(objectMapper.writeValueAsBytes(claims));

            Signature signature = Signature.getInstance("SHA256withECDSAinP1363Format");
            signature.initSign(privateKey);
            signature.update(signingInput.getBytes(StandardCharsets.US_ASCII));

            return signingInput + "." + base64Url(signature.sign());
        } catch (JsonProcessingException | GeneralSecurityException e) {
            throw new VenueAuthenticationException("COINBASE", "sign", "Failed to sign request: " + e.getMessage(), e);
        }
    }

    private String nonce() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String base64Url(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Parse an EC private key from PEM. Literal "\n" sequences (as found in
     * environment variables) are accepted.
     */
    static PrivateKey parsePrivateKey(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new VenueAuthenticationException("COINBASE", "configure", "API secret is missing");
        }
        String normalized = pem.replace("\\n", "\n").trim();
        boolean sec1 = normalized.contains("BEGIN EC PRIVATE KEY");

        String base64 = normalized
            .replaceAll("-----BEGIN [A-Z ]+-----", "")
            .replaceAll("-----END [A-Z ]+-----", "")
            .replaceAll("\\s", "");

        try {
            byte[] der = Base64.getDecoder().decode(base64);
            byte[] pkcs8 = sec1 ? wrapSec1InPkcs8(der) : der;
            return KeyFactory.getInstance("EC").generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new VenueAuthenticationException("COINBASE", "configure",
                "API secret is not a valid EC private key: " + e.getMessage(), e);
        }
    }

    /**
     * PrivateKeyInfo { version 0, id-ecPublicKey/prime256v1, OCTET STRING(sec1) }.
     */
    static byte[] wrapSec1InPkcs8(byte[] sec1) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(new byte[] {0x02, 0x01, 0x00});
        body.writeBytes(EC_P256_ALGORITHM_ID);
        body.write(0x04);
        body.writeBytes(derLength(sec1.length));
        body.writeBytes(sec1);

        byte[] content = body.toByteArray();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x30);
        out.writeBytes(derLength(content.length));
        out.writeBytes(content);
        return out.toByteArray();
    }

    private static byte[] derLength(int length) {
        if (length < 0x80) {
            return new byte[] {(byte) length};
        }
        if (length < 0x100) {
            return new byte[] {(byte) 0x81, (byte) length};
        }
        return new byte[] {(byte) 0x82, (byte) (length >> 8), (byte) length};
    }
}
