/*
 * Where: scheduler configuration
 * What: provides the GitHub RestClient and the bounded executor used for per-repository fetches
 * Why: every outbound call needs timeouts and the fan-out per job must stay bounded
 */
package com.example.scheduler.config;

import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@Configuration
public class GitHubClientConfig {

  @Bean
  RestClient githubRestClient(RestClient.Builder builder, GitHubClientProperties properties) {
    final HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }

  @Bean
  ThreadPoolTaskExecutor githubFetchExecutor(GitHubClientProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.fetchConcurrency());
    executor.setMaxPoolSize(properties.fetchConcurrency());
    executor.setThreadNamePrefix("github-fetch-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
