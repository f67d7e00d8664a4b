package com.github.dimitryivaniuta.solar.payments.config;

import com.github.dimitryivaniuta.solar.payments.web.CorrelationIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.MDC;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Pooled {@link RestTemplate}s for the user, project and contractor services.
 *
 * <p>All three share one Apache HttpClient 5 pool with short timeouts: remote calls fail closed instead of
 * hanging a payment request.</p>
 */
@Slf4j
@Configuration
public class RestClientConfig {

    @Bean(destroyMethod = "close")
    public PoolingHttpClientConnectionManager remoteConnectionManager(AppProperties props) {
        AppProperties.Clients clients = props.getClients();
        return PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(clients.getMaxConnections())
                .setMaxConnPerRoute(clients.getMaxConnectionsPerRoute())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.of(clients.getConnectTimeout()))
                        .setSocketTimeout(Timeout.of(clients.getReadTimeout()))
                        .build())
                .build();
    }

    @Bean
    public HttpComponentsClientHttpRequestFactory remoteRequestFactory(PoolingHttpClientConnectionManager connectionManager,
                                                                      AppProperties props) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.of(props.getClients().getConnectTimeout()))
                .setResponseTimeout(Timeout.of(props.getClients().getReadTimeout()))
                .build();
        HttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();
        log.info("Remote HTTP clients configured. connectTimeout={} readTimeout={} maxConnections={}",
                props.getClients().getConnectTimeout(), props.getClients().getReadTimeout(), props.getClients().getMaxConnections());
        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }

    @Bean
    public RestTemplate userServiceRestTemplate(RestTemplateBuilder builder, HttpComponentsClientHttpRequestFactory remoteRequestFactory,
                                                AppProperties props) {
        return build(builder, remoteRequestFactory, props.getClients().getUserService());
    }

    @Bean
    public RestTemplate projectServiceRestTemplate(RestTemplateBuilder builder, HttpComponentsClientHttpRequestFactory remoteRequestFactory,
                                                   AppProperties props) {
        return build(builder, remoteRequestFactory, props.getClients().getProjectService());
    }

    @Bean
    public RestTemplate contractorServiceRestTemplate(RestTemplateBuilder builder, HttpComponentsClientHttpRequestFactory remoteRequestFactory,
                                                      AppProperties props) {
        return build(builder, remoteRequestFactory, props.getClients().getContractorService());
    }

    private RestTemplate build(RestTemplateBuilder builder, HttpComponentsClientHttpRequestFactory factory, AppProperties.Remote remote) {
        return builder
                .rootUri(remote.getBaseUrl())
                .requestFactory(() -> factory)
                .additionalInterceptors(correlationIdInterceptor())
                .build();
    }

    private static ClientHttpRequestInterceptor correlationIdInterceptor() {
        return (request, body, execution) -> {
            String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
            if (correlationId != null && !request.getHeaders().containsKey(CorrelationIdFilter.CORRELATION_ID_HEADER)) {
                request.getHeaders().add(CorrelationIdFilter.CORRELATION_ID_HEADER, correlationId);
            }
            return execution.execute(request, body);
        };
    }
}
