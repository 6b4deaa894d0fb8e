package net.storefleet.adapter.host.proxy;

import net.storefleet.core.spi.ReverseProxy;

/** 테넌트 server 블록. ACME 검증 경로는 프록시하지 않는다 */
public final class NginxRouteRenderer {
    private final String accessLogDir;
    private final String acmeRoot;

    public NginxRouteRenderer(String accessLogDir, String acmeRoot) {
        this.accessLogDir = accessLogDir;
        this.acmeRoot = acmeRoot;
    }

    public String render(ReverseProxy.Route route) {
        String name = NginxReverseProxy.siteName(route.tenantId());
        return """
            server {
                listen 80;
                listen [::]:80;
                server_name %1$s;

                location /.well-known/acme-challenge/ {
                    root %2$s;
                }

                location / {
                    proxy_pass http://127.0.0.1:%3$d;
                    proxy_set_header Host $host;
                    proxy_set_header X-Real-IP $remote_addr;
                    proxy_set_header X-Forwarded-For $proxy_add_x_forwarded_for;
                    proxy_set_header X-Forwarded-Proto $scheme;

                    proxy_connect_timeout 600;
                    proxy_send_timeout 600;
                    proxy_read_timeout 600;
                    send_timeout 600;

                    client_max_body_size 100M;
                }

                access_log %4$s/%5$s-access.log;
                error_log %4$s/%5$s-error.log;
            }
            """.formatted(route.domain(), acmeRoot, route.port(), accessLogDir, name);
    }

    public String accessLog(long tenantId) {
        return accessLogDir + "/" + NginxReverseProxy.siteName(tenantId) + "-access.log";
    }
}
