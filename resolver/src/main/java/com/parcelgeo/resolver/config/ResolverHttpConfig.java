/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

@Slf4j
@Configuration
public class ResolverHttpConfig {

    /**
     * Every provider client gets the same per-call timeouts; a timeout surfaces as a
     * transport failure of that provider.
     */
    @Bean
    public RestClientCustomizer providerTimeoutCustomizer(ResolverProperties properties) {
        ResolverProperties.Http http = properties.getHttp();
        log.info("Provider HTTP timeouts: connect={}, read={}", http.getConnectTimeout(), http.getReadTimeout());
        return builder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(http.getConnectTimeout());
            requestFactory.setReadTimeout(http.getReadTimeout());
            builder.requestFactory(requestFactory);
        };
    }
}
