package com.github.feedflow.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ThreadPoolTaskExecutor proxyStreamExecutor;
    private final UpstreamRelayInterceptor upstreamRelayInterceptor;

    public WebConfig(@Qualifier("proxyStreamExecutor") ThreadPoolTaskExecutor proxyStreamExecutor,
                     UpstreamRelayInterceptor upstreamRelayInterceptor) {
        this.proxyStreamExecutor = proxyStreamExecutor;
        this.upstreamRelayInterceptor = upstreamRelayInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(upstreamRelayInterceptor).addPathPatterns("/api/youtube/proxy/**");
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        // Playback of a long video keeps one response open for its whole duration.
        configurer.setTaskExecutor(proxyStreamExecutor);
        configurer.setDefaultTimeout(-1);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/youtube/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "HEAD", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("Content-Length", "Content-Range", "Accept-Ranges");
    }
}
