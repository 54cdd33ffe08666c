package by.greenmobile.wavepackcalc.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Puts request correlation data into MDC for the logback pattern
 * (rid, method, path) and echoes the request id back in {@code X-Request-Id},
 * so a client can quote it when a solve fails.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";

    private static final String[] MDC_KEYS = {"rid", "method", "path"};

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String rid = Optional.ofNullable(request.getHeader(HEADER))
                .map(String::trim)
                .filter(h -> !h.isEmpty())
                .orElseGet(() -> UUID.randomUUID().toString().substring(0, 8));

        MDC.put("rid", rid);
        MDC.put("method", request.getMethod());
        MDC.put("path", request.getRequestURI());
        response.setHeader(HEADER, rid);

        try {
            filterChain.doFilter(request, response);
        } finally {
            for (String key : MDC_KEYS) {
                MDC.remove(key);
            }
        }
    }
}
