/**
 * Request logging and timing filter for HTTP requests
 *
 * Features:
 * - Logs incoming HTTP requests with method, URI, and source IP
 * - Measures and logs request processing duration
 * - Records HTTP response status codes
 * - Logs sandbox asset requests at debug level to keep bundle loads out of the info log
 */
package net.fiddleserver.web;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        String uri = req.getRequestURI();
        boolean asset = isSandboxAsset(uri);
        if (asset && !logger.isDebugEnabled()) {
            chain.doFilter(request, response);
            return;
        }

        long startTime = System.currentTimeMillis();
        if (asset) {
            logger.debug("Incoming request: {} {} from {}", req.getMethod(), uri, req.getRemoteAddr());
        } else {
            logger.info("Incoming request: {} {} from {}", req.getMethod(), uri, req.getRemoteAddr());
        }
        try {
            chain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            int status = response instanceof HttpServletResponse httpResponse ? httpResponse.getStatus() : 0;
            if (asset) {
                logger.debug("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
            } else {
                logger.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
            }
        }
    }

    // /sandbox/{version}/{path...}; the bare /sandbox/{version} page is logged normally
    static boolean isSandboxAsset(String uri) {
        if (uri == null || !uri.startsWith("/sandbox/")) {
            return false;
        }
        int versionEnd = uri.indexOf('/', "/sandbox/".length());
        return versionEnd > 0 && versionEnd < uri.length() - 1;
    }
}
