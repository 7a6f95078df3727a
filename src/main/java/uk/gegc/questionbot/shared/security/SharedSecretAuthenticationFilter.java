package uk.gegc.questionbot.shared.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates machine callers by a shared secret carried in a request header.
 * <p>
 * The chat platform presents {@value #CHAT_SECRET_HEADER} on webhook calls and is granted
 * {@link GatewayAuthorities#CHAT_GATEWAY}; the web application presents {@value #API_KEY_HEADER}
 * and is granted {@link GatewayAuthorities#ACCOUNT_ADMIN}. A missing or wrong secret leaves the request
 * anonymous so the entry point answers 401.
 */
@Slf4j
public class SharedSecretAuthenticationFilter extends OncePerRequestFilter {

    public static final String CHAT_SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";
    public static final String API_KEY_HEADER = "X-Api-Key";

    private final byte[] chatWebhookSecret;
    private final byte[] accountApiKey;

    public SharedSecretAuthenticationFilter(String chatWebhookSecret, String accountApiKey) {
        this.chatWebhookSecret = toBytes(chatWebhookSecret);
        this.accountApiKey = toBytes(accountApiKey);
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String chatSecret = request.getHeader(CHAT_SECRET_HEADER);
        String apiKey = request.getHeader(API_KEY_HEADER);

        if (chatSecret != null) {
            if (matches(chatWebhookSecret, chatSecret)) {
                authenticate("chat-gateway", GatewayAuthorities.CHAT_GATEWAY);
            } else {
                log.warn("Rejected chat webhook secret from IP: {}, URI: {}", request.getRemoteAddr(), request.getRequestURI());
            }
        } else if (apiKey != null) {
            if (matches(accountApiKey, apiKey)) {
                authenticate("web-app", GatewayAuthorities.ACCOUNT_ADMIN);
            } else {
                log.warn("Rejected API key from IP: {}, URI: {}", request.getRemoteAddr(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(String principal, String authority) {
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority(authority)));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("Authenticated {} with authority {}", principal, authority);
    }

    private static boolean matches(byte[] expected, String presented) {
        // An unconfigured secret never matches
        if (expected.length == 0) {
            return false;
        }
        return MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] toBytes(String secret) {
        return secret == null || secret.isBlank() ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
    }
}
