/*
 * Where: Notifier configuration
 * What: Provides the RestClient dedicated to push service calls
 * Why: Separate base URL and timeouts per downstream service
 */
package dev.memorynotify.notifier.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(PushServiceProperties.class)
public class PushServiceClientConfig {

  @Bean
  RestClient pushRestClient(RestClient.Builder builder, PushServiceProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
