package com.ospicorp.kpimonitor.security;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.TestingAuthenticationToken;

class AdminAuthorizationTest {

  @Test
  void anyoneMayRefreshWhenAuthIsDisabled() {
    var authz = new AdminAuthorization("kpi:refresh", false);
    assertTrue(authz.canRefresh(null));
  }

  @Test
  void requiresScopeWhenAuthIsEnabled() {
    var authz = new AdminAuthorization("kpi:refresh", true);

    var granted = new TestingAuthenticationToken("ops", null, "SCOPE_kpi:refresh");
    var reader = new TestingAuthenticationToken("viewer", null, "SCOPE_kpi:read");

    assertTrue(authz.canRefresh(granted));
    assertFalse(authz.canRefresh(reader));
    assertFalse(authz.canRefresh(null));
  }

  @Test
  void unauthenticatedTokenIsRejected() {
    var authz = new AdminAuthorization("kpi:refresh", true);
    var token = new TestingAuthenticationToken("ops", null, "SCOPE_kpi:refresh");
    token.setAuthenticated(false);

    assertFalse(authz.canRefresh(token));
  }
}
