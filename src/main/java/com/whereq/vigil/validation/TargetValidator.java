package com.whereq.vigil.validation;

import java.util.regex.Pattern;

/**
 * Validates scan targets.
 *
 * Accepted grammars, checked in this order:
 * <ul>
 *   <li>dotted-quad IPv4, every octet in [0,255]</li>
 *   <li>CIDR {@code ip/prefix}, prefix in [0,32]</li>
 *   <li>range {@code ip-ip}, both endpoints octet-checked, no ordering check</li>
 *   <li>hostname {@code [alnum][-alnum.]*[alnum]}</li>
 * </ul>
 * A string shaped like an address form is judged by that form only; it never falls
 * through to the hostname grammar.
 */
public final class TargetValidator {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}$");
    private static final Pattern CIDR = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}/\\d{1,2}$");
    private static final Pattern RANGE = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}-(\\d{1,3}\\.){3}\\d{1,3}$");
    private static final Pattern HOSTNAME = Pattern.compile("^[a-zA-Z0-9][-a-zA-Z0-9.]*[a-zA-Z0-9]$");

    private TargetValidator() {
    }

    public static boolean isValid(String target) {
        if (target == null || target.isEmpty()) {
            return false;
        }

        if (IPV4.matcher(target).matches()) {
            return octetsInRange(target);
        }

        if (CIDR.matcher(target).matches()) {
            int slash = target.indexOf('/');
            if (!octetsInRange(target.substring(0, slash))) {
                return false;
            }
            int prefix = Integer.parseInt(target.substring(slash + 1));
            return prefix >= 0 && prefix <= 32;
        }

        if (RANGE.matcher(target).matches()) {
            int dash = target.indexOf('-');
            return octetsInRange(target.substring(0, dash)) && octetsInRange(target.substring(dash + 1));
        }

        return HOSTNAME.matcher(target).matches();
    }

    private static boolean octetsInRange(String address) {
        for (String octet : address.split("\\.")) {
            int value = Integer.parseInt(octet);
            if (value < 0 || value > 255) {
                return false;
            }
        }
        return true;
    }
}
