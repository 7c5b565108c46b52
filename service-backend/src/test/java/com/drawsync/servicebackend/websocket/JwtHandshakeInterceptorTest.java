package com.drawsync.servicebackend.websocket;

import com.drawsync.servicebackend.security.AuthenticatedUser;
import com.drawsync.servicebackend.security.JwtProperties;
import com.drawsync.servicebackend.security.JwtService;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class JwtHandshakeInterceptorTest {
    private final JwtService jwtService = new JwtService(
            new JwtProperties("test-secret-test-secret-test-secret-0123456789", 60_000));
    private final JwtHandshakeInterceptor interceptor = new JwtHandshakeInterceptor(jwtService);
    private final AuthenticatedUser alice = new AuthenticatedUser(7L, "alice", "alice@example.com");

    @Test
    void acceptsTokenFromQueryParameter() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/rooms");
        request.setQueryString("token=" + jwtService.generateToken(alice));
        Map<String, Object> attributes = new HashMap<>();

        boolean accepted = interceptor.beforeHandshake(new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(new MockHttpServletResponse()), mock(WebSocketHandler.class), attributes);

        assertTrue(accepted);
        assertEquals(alice, attributes.get(JwtHandshakeInterceptor.USER_ATTRIBUTE));
    }

    @Test
    void acceptsBearerHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/rooms");
        request.addHeader("Authorization", "Bearer " + jwtService.generateToken(alice));
        Map<String, Object> attributes = new HashMap<>();

        assertTrue(interceptor.beforeHandshake(new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(new MockHttpServletResponse()), mock(WebSocketHandler.class), attributes));
        assertEquals(alice, attributes.get(JwtHandshakeInterceptor.USER_ATTRIBUTE));
    }

    @Test
    void rejectsMissingTokenWithUnauthorized() {
        MockHttpServletResponse servletResponse = new MockHttpServletResponse();
        Map<String, Object> attributes = new HashMap<>();

        boolean accepted = interceptor.beforeHandshake(
                new ServletServerHttpRequest(new MockHttpServletRequest("GET", "/ws/rooms")),
                new ServletServerHttpResponse(servletResponse), mock(WebSocketHandler.class), attributes);

        assertFalse(accepted);
        assertEquals(401, servletResponse.getStatus());
        assertTrue(attributes.isEmpty());
    }
}
