package org.jstats.matchsync_api.modules.sources.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(SourceProperties.class)
public class SourceProviderConfig {

    @Bean
    SourceCredentials sourceCredentials(SourceProperties p) {
        return new SourceCredentials(p.credentials());
    }

    @Bean(name = "footballDataOrg")
    RestClient footballDataOrgRestClient(RestClient.Builder builder, SourceProperties p) {
        return baseClient(builder, p.footballDataOrg().baseUrl(), p);
    }

    @Bean(name = "apiFootball")
    RestClient apiFootballRestClient(RestClient.Builder builder, SourceProperties p) {
        return baseClient(builder, p.apiFootball().baseUrl(), p);
    }

    @Bean(name = "footyStats")
    RestClient footyStatsRestClient(RestClient.Builder builder, SourceProperties p) {
        return baseClient(builder, p.footyStats().baseUrl(), p);
    }

    /**
     * Credentials are attached per request by the adapters, so a client exists even for
     * providers without a key.
     */
    private static RestClient baseClient(RestClient.Builder builder, String baseUrl, SourceProperties p) {
        // Connect timeout is configured on the underlying JDK HttpClient:
        var httpClientBuilder = HttpClient.newBuilder();
        if (p.connectTimeout() != null) {
            httpClientBuilder.connectTimeout(p.connectTimeout());
        }
        final var jdkClient = httpClientBuilder.build();

        final var factory = new JdkClientHttpRequestFactory(jdkClient);
        if (p.readTimeout() != null) {
            factory.setReadTimeout(p.readTimeout());
        }

        return builder.clone()
                .baseUrl(baseUrl)
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, p.userAgent())
                .build();
    }
}
