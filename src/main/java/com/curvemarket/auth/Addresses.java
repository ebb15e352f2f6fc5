package com.curvemarket.auth;

import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.ValidationException;
import java.util.Locale;
import java.util.regex.Pattern;

/** Account identifiers are 0x-prefixed 20-byte hex strings, compared case-insensitively. */
public final class Addresses {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {}

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address).matches();
    }

    public static String normalize(String address) {
        if (!isValid(address)) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, "Not a valid address: " + address);
        }
        return address.toLowerCase(Locale.ROOT);
    }
}
