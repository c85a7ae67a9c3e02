/*
 * どこで: Common サービス登録
 * 何を: Consul agent の HTTP API にサービスと gRPC health check を登録する
 * なぜ: gateway や他サービスが論理名でこのサービスを発見できるようにするため
 */
package com.example.mesh.common.registry;

import com.example.mesh.common.config.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class ConsulRegistrant implements RegistryRegistrant {

  private static final Logger logger = LoggerFactory.getLogger(ConsulRegistrant.class);
  static final String REGISTER_PATH = "/v1/agent/service/register";
  static final String TOKEN_HEADER = "X-Consul-Token";

  private final RestClient consulRestClient;
  private final RegistryProperties properties;

  public ConsulRegistrant(RestClient consulRestClient, RegistryProperties properties) {
    this.consulRestClient = consulRestClient;
    this.properties = properties;
  }

  @Override
  public void register(ServiceIdentity identity, HealthCheckDescriptor healthCheck) {
    final ConsulServiceRegistration registration =
        ConsulServiceRegistration.of(identity, healthCheck);
    try {
      final RestClient.RequestBodySpec spec =
          consulRestClient.put().uri(REGISTER_PATH).contentType(MediaType.APPLICATION_JSON);
      if (!properties.token().isBlank()) {
        spec.header(TOKEN_HEADER, properties.token());
      }
      spec.body(registration).retrieve().toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw new RegistrationException(
          "consul rejected registration status=" + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      throw new RegistrationException("consul agent unreachable at " + properties.baseUrl(), ex);
    } catch (RestClientException ex) {
      throw new RegistrationException("consul registration failed", ex);
    }
    logger.info(
        "service registered with consul id={} target={} check={} interval={}",
        registration.id(),
        identity.target(),
        healthCheck.protocol(),
        healthCheck.interval());
  }
}
