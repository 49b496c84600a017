package io.b2mash.realtime.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

class ApiKeyAuthFilterTest {

  private final ApiKeyAuthFilter filter = new ApiKeyAuthFilter("test-api-key");

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void validKey_authenticatesPeerNode() throws Exception {
    var request = new MockHttpServletRequest("POST", "/internal/tenants/t1/connect");
    request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, "test-api-key");
    var response = new MockHttpServletResponse();
    var chain = new MockFilterChain();

    filter.doFilter(request, response, chain);

    assertThat(chain.getRequest()).isNotNull();
    var authentication = SecurityContextHolder.getContext().getAuthentication();
    assertThat(authentication.isAuthenticated()).isTrue();
    assertThat(authentication.getAuthorities())
        .extracting(Object::toString)
        .containsExactly("ROLE_PEER_NODE");
  }

  @Test
  void wrongKey_isRejected() throws Exception {
    var request = new MockHttpServletRequest("POST", "/internal/tenants/t1/connect");
    request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, "nope");
    var response = new MockHttpServletResponse();
    var chain = new MockFilterChain();

    filter.doFilter(request, response, chain);

    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(chain.getRequest()).isNull();
  }

  @Test
  void missingKey_isRejected() throws Exception {
    var request = new MockHttpServletRequest("DELETE", "/internal/tenants/t1/connection");
    var response = new MockHttpServletResponse();

    filter.doFilter(request, response, new MockFilterChain());

    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void publicPaths_areNotFiltered() throws Exception {
    var request = new MockHttpServletRequest("GET", "/actuator/health");
    var response = new MockHttpServletResponse();
    var chain = new MockFilterChain();

    filter.doFilter(request, response, chain);

    assertThat(chain.getRequest()).isNotNull();
    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
  }
}
