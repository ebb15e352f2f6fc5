package com.curvemarket.auth;

/** Checks that a typed message was signed by an expected account. */
public interface SignatureVerifier {

    boolean verify(Eip712Domain domain, TypedMessage message, String signatureHex, String expectedSigner);
}
