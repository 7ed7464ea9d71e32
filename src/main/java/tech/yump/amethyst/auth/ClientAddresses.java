package tech.yump.amethyst.auth;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

/**
 * Resolves the caller address: the {@code X-Real-IP} header set by the reverse proxy, else the
 * socket peer address.
 */
public final class ClientAddresses {

    public static final String REAL_IP_HEADER = "X-Real-IP";

    private ClientAddresses() {
    }

    public static String resolve(HttpServletRequest request) {
        String realIp = request.getHeader(REAL_IP_HEADER);
        if (StringUtils.hasText(realIp)) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
