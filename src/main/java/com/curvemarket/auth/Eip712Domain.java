package com.curvemarket.auth;

/** Binds signatures to one market instance on one chain. */
public record Eip712Domain(String name, String version, long chainId, String verifyingContract) {

    public static final String NAME = "CurveMarket";
    public static final String VERSION = "1";

    public static Eip712Domain forMarket(long chainId, String marketAddress) {
        return new Eip712Domain(NAME, VERSION, chainId, marketAddress);
    }
}
