package io.intellixity.sqlgate.server.web;

import io.intellixity.sqlgate.gateway.TenantContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Resolves the tenant key of an API request and binds it for the rest of the request.\n
 *
 * The {@value #TENANT_HEADER} header wins; without it the configured default tenant is used, and without a default
 * the request is rejected with 400. The health endpoint is exempt.\n
 */
public final class TenantKeyFilter extends OncePerRequestFilter {
  public static final String TENANT_HEADER = "X-Tenant-Key";

  private final String defaultTenant;

  public TenantKeyFilter(String defaultTenant) {
    this.defaultTenant = (defaultTenant == null || defaultTenant.isBlank()) ? null : defaultTenant.trim();
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI().substring(request.getContextPath().length());
    return !path.startsWith("/api/") || path.equals("/api/health");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String tenantKey = request.getHeader(TENANT_HEADER);
    if (tenantKey == null || tenantKey.isBlank()) {
      tenantKey = defaultTenant;
    }
    if (tenantKey == null) {
      response.sendError(400, "Missing required header: " + TENANT_HEADER);
      return;
    }

    try {
      TenantContext.inContext(tenantKey.trim(), () -> {
        try {
          filterChain.doFilter(request, response);
        } catch (IOException | ServletException e) {
          throw new TunneledException(e);
        }
        return null;
      });
    } catch (TunneledException e) {
      Throwable c = e.getCause();
      if (c instanceof IOException ioe) throw ioe;
      throw (ServletException) c;
    }
  }

  private static final class TunneledException extends RuntimeException {
    TunneledException(Exception cause) {
      super(cause);
    }
  }
}
