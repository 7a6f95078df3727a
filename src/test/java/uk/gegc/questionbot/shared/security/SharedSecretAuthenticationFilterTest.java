package uk.gegc.questionbot.shared.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SharedSecretAuthenticationFilter")
class SharedSecretAuthenticationFilterTest {

    private final SharedSecretAuthenticationFilter filter =
            new SharedSecretAuthenticationFilter("chat-secret", "api-key");

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private Authentication run(MockHttpServletRequest request) throws Exception {
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        assertThat(chain.getRequest()).isNotNull();
        return SecurityContextHolder.getContext().getAuthentication();
    }

    @Test
    @DisplayName("the webhook secret grants the chat gateway authority")
    void chatSecret_grantsChatGateway() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/chat/updates");
        request.addHeader(SharedSecretAuthenticationFilter.CHAT_SECRET_HEADER, "chat-secret");

        Authentication authentication = run(request);

        assertThat(authentication).isNotNull();
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly(GatewayAuthorities.CHAT_GATEWAY);
    }

    @Test
    @DisplayName("the API key grants the account admin authority")
    void apiKey_grantsAccountAdmin() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/accounts/balance");
        request.addHeader(SharedSecretAuthenticationFilter.API_KEY_HEADER, "api-key");

        assertThat(run(request).getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly(GatewayAuthorities.ACCOUNT_ADMIN);
    }

    @Test
    @DisplayName("a wrong secret leaves the request anonymous")
    void wrongSecret_anonymous() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/chat/updates");
        request.addHeader(SharedSecretAuthenticationFilter.CHAT_SECRET_HEADER, "api-key");

        assertThat(run(request)).isNull();
    }

    @Test
    @DisplayName("an unconfigured secret never matches")
    void blankSecret_neverMatches() throws Exception {
        SharedSecretAuthenticationFilter unconfigured = new SharedSecretAuthenticationFilter("", null);
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/chat/updates");
        request.addHeader(SharedSecretAuthenticationFilter.CHAT_SECRET_HEADER, "");

        unconfigured.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }
}
