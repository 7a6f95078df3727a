package uk.gegc.questionbot.shared.security;

public final class GatewayAuthorities {

    public static final String CHAT_GATEWAY = "CHAT_GATEWAY";
    public static final String ACCOUNT_ADMIN = "ACCOUNT_ADMIN";

    private GatewayAuthorities() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
