package com.clapgrow.bridge.common.phone;

import java.util.Optional;

/**
 * Phone number and WhatsApp JID helpers.
 */
public final class PhoneNumbers {

    public static final String USER_SERVER = "s.whatsapp.net";
    public static final String GROUP_SERVER = "g.us";

    private static final String BRAZIL_PREFIX = "+55";
    // +55 AA NNNNNNNN
    private static final int BRAZIL_LEGACY_LENGTH = 13;
    // +55 AA 9NNNNNNNN
    private static final int BRAZIL_MOBILE_LENGTH = 14;

    private PhoneNumbers() {
    }

    /**
     * Normalize any phone-like string to {@code +<digits>}.
     *
     * <p>{@code "5511999999999"}, {@code "+55 (11) 99999-9999"} and
     * {@code "+5511999999999"} all become {@code "+5511999999999"}.
     */
    public static String toE164(String raw) {
        if (raw == null) {
            return "+";
        }
        StringBuilder digits = new StringBuilder(raw.length() + 1).append('+');
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }

    /**
     * Local part of a JID: everything before {@code '@'}, or the whole value when there is none.
     * A device suffix ({@code "5511999999999:12@s.whatsapp.net"}) is dropped.
     */
    public static String localPart(String jid) {
        if (jid == null) {
            return "";
        }
        int at = jid.indexOf('@');
        String user = at >= 0 ? jid.substring(0, at) : jid;
        int device = user.indexOf(':');
        return device >= 0 ? user.substring(0, device) : user;
    }

    public static boolean isGroup(String jid) {
        return jid != null && jid.endsWith("@" + GROUP_SERVER);
    }

    /**
     * Build the user JID for a bare number. Non-digits (including a leading '+') are dropped.
     */
    public static String userJid(String number) {
        return toE164(number).substring(1) + "@" + USER_SERVER;
    }

    /**
     * Brazilian mobile numbers exist in two forms, with and without the ninth digit.
     * Returns the other form when {@code e164} is a Brazilian number of either shape.
     */
    public static Optional<String> brazilianAlternate(String e164) {
        if (e164 == null || !e164.startsWith(BRAZIL_PREFIX)) {
            return Optional.empty();
        }
        String areaAndNumber = e164.substring(BRAZIL_PREFIX.length());
        if (e164.length() == BRAZIL_MOBILE_LENGTH && areaAndNumber.charAt(2) == '9') {
            return Optional.of(BRAZIL_PREFIX + areaAndNumber.substring(0, 2) + areaAndNumber.substring(3));
        }
        if (e164.length() == BRAZIL_LEGACY_LENGTH) {
            return Optional.of(BRAZIL_PREFIX + areaAndNumber.substring(0, 2) + "9" + areaAndNumber.substring(2));
        }
        return Optional.empty();
    }
}
