package com.crewlife.booking.security;

import com.crewlife.booking.config.BookingAccessProperties;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.Parameter;
import software.amazon.awssdk.services.ssm.model.SsmException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdminApiKeyFilter Tests")
class AdminApiKeyFilterTest {

    @Mock
    private FilterChain filterChain;

    @Mock
    private SsmClient ssmClient;

    private BookingAccessProperties properties;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        properties = new BookingAccessProperties();
        response = new MockHttpServletResponse();
    }

    private MockHttpServletRequest adminRequest(String apiKey) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/admin/links");
        if (apiKey != null) {
            request.addHeader(AdminApiKeyFilter.API_KEY_HEADER, apiKey);
        }
        return request;
    }

    @Nested
    @DisplayName("Configured key")
    class ConfiguredKeyTests {

        private AdminApiKeyFilter filter;

        @BeforeEach
        void setUp() {
            properties.getAdmin().setApiKey("admin-secret");
            filter = new AdminApiKeyFilter(properties, null);
        }

        @Test
        void matchingKey_PassesThrough() throws Exception {
            MockHttpServletRequest request = adminRequest("admin-secret");

            filter.doFilter(request, response, filterChain);

            verify(filterChain).doFilter(request, response);
            assertEquals(200, response.getStatus());
        }

        @Test
        void missingKey_Returns401() throws Exception {
            filter.doFilter(adminRequest(null), response, filterChain);

            assertEquals(401, response.getStatus());
            assertTrue(response.getContentAsString().contains("Missing API key"));
            verifyNoInteractions(filterChain);
        }

        @Test
        void wrongKey_Returns401() throws Exception {
            filter.doFilter(adminRequest("guess"), response, filterChain);

            assertEquals(401, response.getStatus());
            assertTrue(response.getContentAsString().contains("Invalid API key"));
            verifyNoInteractions(filterChain);
        }

        @Test
        void candidateEndpoint_IsNotFiltered() throws Exception {
            MockHttpServletRequest request = new MockHttpServletRequest("POST", "/access/confirm");

            filter.doFilter(request, response, filterChain);

            verify(filterChain).doFilter(request, response);
        }
    }

    @Nested
    @DisplayName("Parameter Store key")
    class ParameterStoreTests {

        @Test
        void keyFromParameterStore_IsCachedBetweenRequests() throws Exception {
            when(ssmClient.getParameter(any(GetParameterRequest.class))).thenReturn(GetParameterResponse.builder()
                .parameter(Parameter.builder().value("stored-secret").build())
                .build());
            AdminApiKeyFilter filter = new AdminApiKeyFilter(properties, ssmClient);

            filter.doFilter(adminRequest("stored-secret"), response, filterChain);
            filter.doFilter(adminRequest("stored-secret"), new MockHttpServletResponse(), filterChain);

            verify(filterChain, times(2)).doFilter(any(), any());
            verify(ssmClient, times(1)).getParameter(any(GetParameterRequest.class));
        }

        @Test
        void parameterStoreFailure_Returns503() throws Exception {
            when(ssmClient.getParameter(any(GetParameterRequest.class)))
                .thenThrow(SsmException.builder().message("access denied").build());
            AdminApiKeyFilter filter = new AdminApiKeyFilter(properties, ssmClient);

            filter.doFilter(adminRequest("anything"), response, filterChain);

            assertEquals(503, response.getStatus());
            verifyNoInteractions(filterChain);
        }

        @Test
        void noKeySourceAtAll_Returns503() throws Exception {
            AdminApiKeyFilter filter = new AdminApiKeyFilter(properties, null);

            filter.doFilter(adminRequest("anything"), response, filterChain);

            assertEquals(503, response.getStatus());
            assertTrue(response.getContentAsString().contains("Admin access is not configured"));
        }
    }
}
