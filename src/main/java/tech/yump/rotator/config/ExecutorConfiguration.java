package tech.yump.rotator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import tech.yump.rotator.rotation.RetryPolicy;

import java.net.http.HttpClient;

/**
 * Beans shared by the function executors: the HTTP client and the retry policy applied around
 * executor calls. Connect and read timeouts come from {@code rotator.http.*}; redirects are not followed.
 */
@Slf4j
@Configuration
public class ExecutorConfiguration {

    @Bean
    public RestClient rotatorRestClient(RestClient.Builder builder, RotatorProperties properties) {
        RotatorProperties.HttpProperties http = properties.http();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(http.connectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(http.readTimeout());
        log.info("Configuring rotation HTTP client: connectTimeout={}, readTimeout={}",
                http.connectTimeout(), http.readTimeout());
        return builder.requestFactory(requestFactory).build();
    }

    @Bean
    public RetryPolicy rotationRetryPolicy(RotatorProperties properties) {
        RotatorProperties.RetryProperties retry = properties.retry();
        log.info("Configuring executor retry policy: maxAttempts={}, initialDelay={}, maxDelay={}, multiplier={}",
                retry.maxAttempts(), retry.initialDelay(), retry.maxDelay(), retry.multiplier());
        return RetryPolicy.from(retry);
    }
}
