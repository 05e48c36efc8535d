package com.crewlife.booking.security;

import com.crewlife.booking.config.BookingAccessProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.SsmException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authenticates recruiter and administrator requests.
 * Validates the X-Api-Key header against {@code booking.admin.api-key}, or the value stored
 * in Parameter Store when no key is configured. Only applies to /admin/** endpoints.
 */
@Component
public class AdminApiKeyFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(AdminApiKeyFilter.class);
    static final String API_KEY_HEADER = "X-Api-Key";
    private static final String ADMIN_PATH_PREFIX = "/admin/";
    private static final long CACHE_TTL_MS = 5 * 60 * 1000;

    private final BookingAccessProperties properties;
    private final SsmClient ssmClient;

    // Cached Parameter Store value
    private volatile String cachedApiKey;
    private volatile long cacheExpiry = 0;

    @Autowired
    public AdminApiKeyFilter(BookingAccessProperties properties,
                             @Autowired(required = false) SsmClient ssmClient) {
        this.properties = properties;
        this.ssmClient = ssmClient;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(ADMIN_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String providedApiKey = request.getHeader(API_KEY_HEADER);
        if (providedApiKey == null || providedApiKey.isBlank()) {
            logger.warn("Missing API key for admin endpoint: {}", request.getRequestURI());
            reject(response, HttpServletResponse.SC_UNAUTHORIZED, "Missing API key");
            return;
        }

        String expectedApiKey = getApiKey();
        if (expectedApiKey == null) {
            logger.error("No admin API key available; admin endpoints are disabled");
            reject(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Admin access is not configured");
            return;
        }

        if (!MessageDigest.isEqual(expectedApiKey.getBytes(StandardCharsets.UTF_8),
                                   providedApiKey.getBytes(StandardCharsets.UTF_8))) {
            logger.warn("Invalid API key for admin endpoint: {}", request.getRequestURI());
            reject(response, HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\": \"" + message + "\"}");
    }

    private String getApiKey() {
        String configured = properties.getAdmin().getApiKey();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        if (ssmClient == null) {
            return null;
        }

        long now = System.currentTimeMillis();
        if (cachedApiKey != null && now < cacheExpiry) {
            return cachedApiKey;
        }

        synchronized (this) {
            if (cachedApiKey != null && System.currentTimeMillis() < cacheExpiry) {
                return cachedApiKey;
            }
            try {
                cachedApiKey = ssmClient.getParameter(GetParameterRequest.builder()
                        .name(properties.getAdmin().getApiKeyParameter())
                        .withDecryption(true)
                        .build())
                    .parameter()
                    .value();
                cacheExpiry = System.currentTimeMillis() + CACHE_TTL_MS;
                logger.debug("Refreshed admin API key from Parameter Store");
                return cachedApiKey;
            } catch (SsmException e) {
                logger.error("Failed to retrieve admin API key from Parameter Store: {}", e.getMessage());
                return null;
            }
        }
    }
}
