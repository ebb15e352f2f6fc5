package com.curvemarket.auth;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

/**
 * EIP-712 verifier: hashes the typed message under the market domain and recovers the
 * secp256k1 signer from a 65-byte {@code r || s || v} signature.
 *
 * <p>{@code v} may be given as 0/1 or 27/28.
 */
@Component
public class Eip712SignatureVerifier implements SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(Eip712SignatureVerifier.class);

    private static final String DOMAIN_TYPE =
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";
    private static final Pattern SIGNATURE = Pattern.compile("^0x[0-9a-fA-F]{130}$");
    private static final byte[] PREFIX = {0x19, 0x01};

    @Override
    public boolean verify(Eip712Domain domain, TypedMessage message, String signatureHex, String expectedSigner) {
        if (expectedSigner == null) {
            return false;
        }
        return recoverSigner(digest(domain, message), signatureHex)
                .map(signer -> signer.equalsIgnoreCase(expectedSigner))
                .orElse(false);
    }

    /** Hash that signers sign: {@code keccak256(0x1901 || domainSeparator || hashStruct(message))}. */
    public byte[] digest(Eip712Domain domain, TypedMessage message) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(PREFIX);
        out.writeBytes(domainSeparator(domain));
        out.writeBytes(hashStruct(message));
        return Hash.sha3(out.toByteArray());
    }

    public byte[] domainSeparator(Eip712Domain domain) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(keccak(DOMAIN_TYPE));
        out.writeBytes(keccak(domain.name()));
        out.writeBytes(keccak(domain.version()));
        out.writeBytes(word(BigInteger.valueOf(domain.chainId())));
        out.writeBytes(encodeAddress(domain.verifyingContract()));
        return Hash.sha3(out.toByteArray());
    }

    public byte[] hashStruct(TypedMessage message) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(keccak(message.encodeType()));
        for (TypedMessage.Field field : message.fields()) {
            out.writeBytes(encodeValue(field.type(), field.value()));
        }
        return Hash.sha3(out.toByteArray());
    }

    /** Recovers the lower-case signer address, or empty for a malformed or unrecoverable signature. */
    public Optional<String> recoverSigner(byte[] digest, String signatureHex) {
        if (signatureHex == null || !SIGNATURE.matcher(signatureHex).matches()) {
            log.debug("Rejected malformed signature");
            return Optional.empty();
        }
        byte[] raw = Numeric.hexStringToByteArray(signatureHex);
        byte v = raw[64];
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData signatureData =
                new Sign.SignatureData(v, Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64));
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(digest, signatureData);
            return Optional.of(Numeric.prependHexPrefix(Keys.getAddress(publicKey)).toLowerCase(Locale.ROOT));
        } catch (SignatureException | RuntimeException e) {
            log.debug("Signature recovery failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static byte[] encodeValue(String type, Object value) {
        return switch (type) {
            case "address" -> encodeAddress((String) value);
            case "bool" -> word(Boolean.TRUE.equals(value) ? BigInteger.ONE : BigInteger.ZERO);
            case "uint8", "uint256" -> word((BigInteger) value);
            case "address[]", "bool[]" -> {
                String elementType = type.substring(0, type.length() - 2);
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                for (Object element : (List<?>) value) {
                    out.writeBytes(encodeValue(elementType, element));
                }
                yield Hash.sha3(out.toByteArray());
            }
            default -> throw new IllegalArgumentException("Unsupported typed-data field type " + type);
        };
    }

    private static byte[] encodeAddress(String address) {
        return word(Numeric.toBigInt(address));
    }

    private static byte[] word(BigInteger value) {
        return Numeric.toBytesPadded(value, 32);
    }

    private static byte[] keccak(String text) {
        return Hash.sha3(text.getBytes(StandardCharsets.UTF_8));
    }
}
