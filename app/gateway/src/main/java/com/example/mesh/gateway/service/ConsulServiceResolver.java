/*
 * どこで: Gateway サービス層
 * 何を: Consul の health API から passing なインスタンスを取得し、ラウンドロビンで選ぶ
 * なぜ: 登録済みかつ health check を通過したインスタンスだけに呼び出しを向けるため
 */
package com.example.mesh.gateway.service;

import com.example.mesh.common.config.RegistryProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class ConsulServiceResolver {

  private static final Logger logger = LoggerFactory.getLogger(ConsulServiceResolver.class);
  static final String HEALTH_PATH = "/v1/health/service/{name}?passing=true";
  static final String TOKEN_HEADER = "X-Consul-Token";
  private static final ParameterizedTypeReference<List<ConsulHealthEntry>> ENTRIES =
      new ParameterizedTypeReference<>() {};

  private final RestClient consulRestClient;
  private final RegistryProperties properties;
  private final ConcurrentMap<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public ConsulServiceResolver(RestClient consulRestClient, RegistryProperties properties) {
    this.consulRestClient = consulRestClient;
    this.properties = properties;
  }

  public ServiceInstance resolve(String serviceName) {
    final List<ConsulHealthEntry> entries = fetchPassing(serviceName);
    final List<ServiceInstance> instances =
        entries.stream()
            .filter(entry -> entry.service() != null && entry.service().port() > 0)
            .map(entry -> toInstance(serviceName, entry))
            .filter(instance -> instance.host() != null && !instance.host().isBlank())
            .toList();
    if (instances.isEmpty()) {
      logger.warn("no passing instance service={}", serviceName);
      throw new ServiceIntegrationException(
          ServiceIntegrationException.Reason.UNAVAILABLE,
          serviceName,
          "no passing instance of " + serviceName);
    }
    final int index =
        Math.floorMod(
            cursors.computeIfAbsent(serviceName, ignored -> new AtomicInteger()).getAndIncrement(),
            instances.size());
    return instances.get(index);
  }

  private List<ConsulHealthEntry> fetchPassing(String serviceName) {
    try {
      final List<ConsulHealthEntry> entries =
          consulRestClient
              .get()
              .uri(HEALTH_PATH, serviceName)
              .headers(
                  headers -> {
                    if (!properties.token().isBlank()) {
                      headers.set(TOKEN_HEADER, properties.token());
                    }
                  })
              .retrieve()
              .body(ENTRIES);
      return entries == null ? List.of() : entries;
    } catch (RestClientResponseException ex) {
      logger.warn(
          "consul health lookup failed service={} status={}",
          serviceName,
          ex.getStatusCode().value());
      throw new ServiceIntegrationException(
          ServiceIntegrationException.Reason.BAD_GATEWAY,
          serviceName,
          "service registry lookup failed",
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("consul health lookup timed out service={}", serviceName);
        throw new ServiceIntegrationException(
            ServiceIntegrationException.Reason.TIMEOUT,
            serviceName,
            "service registry lookup timeout",
            ex);
      }
      logger.warn("consul agent unreachable service={}", serviceName, ex);
      throw new ServiceIntegrationException(
          ServiceIntegrationException.Reason.BAD_GATEWAY,
          serviceName,
          "service registry unreachable",
          ex);
    } catch (RestClientException ex) {
      throw new ServiceIntegrationException(
          ServiceIntegrationException.Reason.BAD_GATEWAY,
          serviceName,
          "service registry response is invalid",
          ex);
    }
  }

  private ServiceInstance toInstance(String serviceName, ConsulHealthEntry entry) {
    // Service.Address が空の場合は Consul の仕様どおり Node.Address を使う
    final String serviceAddress = entry.service().address();
    final String host =
        serviceAddress == null || serviceAddress.isBlank()
            ? entry.node() == null ? null : entry.node().address()
            : serviceAddress;
    return new ServiceInstance(serviceName, host, entry.service().port());
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
