package com.simplexlint.interfaces.api.lint;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestSizeLimitFilterTest {

    private static final long LIMIT = 128;

    private RequestSizeLimitFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RequestSizeLimitFilter(new ObjectMapper(), LIMIT);
    }

    // Chunked uploads carry no Content-Length
    private static MockHttpServletRequest chunkedRequest(String uri, byte[] body) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", uri) {
            @Override
            public long getContentLengthLong() {
                return -1;
            }
        };
        request.setContent(body);
        return request;
    }

    @Test
    void declared_length_over_limit_is_rejected_before_reading() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/lint");
        request.setContent(new byte[200]);
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain chain = (req, res) -> {
            throw new AssertionError("chain must not run");
        };

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(413);
        assertThat(response.getContentAsString()).contains("SPEC_TOO_LARGE").contains("128 bytes");
    }

    @Test
    void undeclared_length_fails_once_limit_is_read() {
        MockHttpServletRequest request = chunkedRequest("/api/lint", new byte[200]);
        FilterChain chain = (req, res) -> req.getInputStream().readAllBytes();

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), chain))
                .isInstanceOf(SpecTooLargeException.class)
                .hasMessageContaining("128 bytes");
    }

    @Test
    void body_within_limit_passes_through() throws Exception {
        byte[] body = "{\"spec\": \"FUNCTION: f() → x\"}".getBytes(StandardCharsets.UTF_8);
        MockHttpServletRequest request = chunkedRequest("/api/lint", body);
        AtomicReference<byte[]> seen = new AtomicReference<>();

        filter.doFilter(request, new MockHttpServletResponse(),
                (req, res) -> seen.set(req.getInputStream().readAllBytes()));

        assertThat(seen.get()).isEqualTo(body);
    }

    @Test
    void non_api_paths_are_not_limited() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.setContent(new byte[200]);
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<Boolean> ran = new AtomicReference<>(false);

        filter.doFilter(request, response, (req, res) -> ran.set(true));

        assertThat(ran.get()).isTrue();
        assertThat(response.getStatus()).isEqualTo(200);
    }
}
