package com.phillippitts.linkband.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags supervisor HTTP calls in Log4j2's ThreadContext so a command can be followed from the
 * controller onto the reactor thread.
 *
 * <p>Entries:</p>
 * <ul>
 *   <li>requestId: the caller's X-Request-ID when it is a short token, else a generated UUID.
 *       It is echoed back in the response header.</li>
 *   <li>command: for a mutating call under {@code /supervisor/}, the operation name
 *       ({@code connect}, {@code streaming}, ...). Reads carry no command.</li>
 * </ul>
 *
 * <p>The reactor copies the submitting thread's context onto each task, so log lines of a
 * command's execution carry the same entries. Entries are removed when the request ends and
 * whatever the container thread had before is left in place.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String REQUEST_ID = "requestId";
    static final String COMMAND = "command";

    private static final String SUPERVISOR_PREFIX = "/supervisor/";
    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        String requestId = requestId(http);
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        }
        Map<String, String> entries = new HashMap<>();
        entries.put(REQUEST_ID, requestId);
        String command = command(http);
        if (command != null) {
            entries.put(COMMAND, command);
        }
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.putAll(entries)) {
            chain.doFilter(request, response);
        }
    }

    // Header values end up in every log line; anything but a short token is replaced.
    private static String requestId(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v != null && SAFE_REQUEST_ID.matcher(v).matches()) ? v : UUID.randomUUID().toString();
    }

    static String command(HttpServletRequest req) {
        if ("GET".equalsIgnoreCase(req.getMethod()) || "HEAD".equalsIgnoreCase(req.getMethod())) {
            return null;
        }
        String uri = req.getRequestURI();
        if (uri == null || !uri.startsWith(SUPERVISOR_PREFIX)) {
            return null;
        }
        String rest = uri.substring(SUPERVISOR_PREFIX.length());
        int slash = rest.indexOf('/');
        String name = slash < 0 ? rest : rest.substring(0, slash);
        return name.isEmpty() ? null : name;
    }
}
