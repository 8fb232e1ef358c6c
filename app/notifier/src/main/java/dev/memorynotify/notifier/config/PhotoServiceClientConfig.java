/*
 * Where: Notifier configuration
 * What: Provides the RestClient dedicated to photo service calls
 * Why: Separate base URL and timeouts per downstream service
 */
package dev.memorynotify.notifier.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(PhotoServiceProperties.class)
public class PhotoServiceClientConfig {

  @Bean
  RestClient photoRestClient(RestClient.Builder builder, PhotoServiceProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
