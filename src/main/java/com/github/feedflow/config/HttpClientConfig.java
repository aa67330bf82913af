package com.github.feedflow.config;

import com.github.feedflow.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final StreamProxyProperties properties;

    /**
     * Client for upstream media and metadata. Routed through the outbound proxy when one is configured.
     */
    @Bean(name = "upstreamHttpClient")
    public OkHttpClient upstreamHttpClient() {
        OkHttpClient.Builder builder = baseBuilder();

        if (properties.getNetwork().isProxyConfigured()) {
            String proxyUrl = properties.getNetwork().getProxyUrl();
            builder.proxy(toProxy(proxyUrl));
            String credentials = proxyCredentials(proxyUrl);
            if (credentials != null) {
                builder.proxyAuthenticator((route, response) -> response.request().newBuilder()
                        .header("Proxy-Authorization", credentials)
                        .build());
            }
            log.info("Outbound proxy enabled for upstream requests: {}", redact(proxyUrl));
        }

        return builder.build();
    }

    /**
     * Client that always connects directly. Used as the second attempt when a proxied download fails.
     */
    @Bean(name = "directHttpClient")
    public OkHttpClient directHttpClient() {
        return baseBuilder()
                .proxy(Proxy.NO_PROXY)
                .build();
    }

    private OkHttpClient.Builder baseBuilder() {
        StreamProxyProperties.Stream stream = properties.getStream();
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(stream.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(stream.getReadTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(stream.getReadTimeoutSeconds()))
                .addInterceptor(new UserAgentInterceptor(stream.getUserAgent()))
                .retryOnConnectionFailure(false)
                .followRedirects(true)
                .followSslRedirects(true);
    }

    static Proxy toProxy(String proxyUrl) {
        URI uri;
        try {
            uri = URI.create(proxyUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid proxy URL", "feedflow.network.proxy-url", e);
        }

        if (uri.getHost() == null) {
            throw new ConfigurationException("Proxy URL has no host", "feedflow.network.proxy-url");
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase() : "http";
        Proxy.Type type = scheme.startsWith("socks") ? Proxy.Type.SOCKS : Proxy.Type.HTTP;
        int port = uri.getPort();
        if (port < 0) {
            port = switch (scheme) {
                case "https" -> 443;
                case "socks", "socks4", "socks5", "socks5h" -> 1080;
                default -> 80;
            };
        }
        return new Proxy(type, InetSocketAddress.createUnresolved(uri.getHost(), port));
    }

    static String proxyCredentials(String proxyUrl) {
        String userInfo = URI.create(proxyUrl.trim()).getRawUserInfo();
        if (userInfo == null || userInfo.isEmpty()) {
            return null;
        }
        int separator = userInfo.indexOf(':');
        String user = separator >= 0 ? userInfo.substring(0, separator) : userInfo;
        String password = separator >= 0 ? userInfo.substring(separator + 1) : "";
        return Credentials.basic(
                URLDecoder.decode(user, StandardCharsets.UTF_8),
                URLDecoder.decode(password, StandardCharsets.UTF_8));
    }

    static String redact(String proxyUrl) {
        return proxyUrl.replaceAll("//[^@/]*@", "//***@");
    }

    /**
     * Presents a browser User-Agent; media hosts reject the OkHttp default.
     */
    private static class UserAgentInterceptor implements Interceptor {

        private final String userAgent;

        UserAgentInterceptor(String userAgent) {
            this.userAgent = userAgent;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request original = chain.request();
            if (original.header("User-Agent") != null) {
                return chain.proceed(original);
            }
            return chain.proceed(original.newBuilder()
                    .header("User-Agent", userAgent)
                    .build());
        }
    }
}
