package com.jasmin.requestguard.models;

import lombok.Value;

/**
 * Rate-limit key of a client: {@code token:<hash>}, {@code user:<id>} or {@code ip:<address>}.
 */
@Value
public class ClientIdentity {

    public enum Kind {
        TOKEN("token"),
        USER("user"),
        IP("ip");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    Kind kind;
    String value;

    public static ClientIdentity token(String hashedToken) {
        return new ClientIdentity(Kind.TOKEN, hashedToken);
    }

    public static ClientIdentity user(String userId) {
        return new ClientIdentity(Kind.USER, userId);
    }

    public static ClientIdentity ip(String address) {
        return new ClientIdentity(Kind.IP, address);
    }

    public String key() {
        return kind.getPrefix() + ":" + value;
    }

    @Override
    public String toString() {
        return key();
    }
}
