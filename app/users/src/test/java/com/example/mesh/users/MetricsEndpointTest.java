package com.example.mesh.users;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.mesh.common.bootstrap.BootstrapMetrics;
import com.example.mesh.common.grpc.RpcMetrics;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@AutoConfigureObservability
@ActiveProfiles("test")
class MetricsEndpointTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private RpcMetrics rpcMetrics;
  @Autowired private BootstrapMetrics bootstrapMetrics;

  @Test
  void prometheusEndpointExposesBootstrapAndRpcMeters() throws Exception {
    bootstrapMetrics.recordConnectAttempt("database", "failure");
    rpcMetrics.recordCall("users.UserService/GetUser", "OK", Duration.ofMillis(5));

    mockMvc
        .perform(get("/actuator/prometheus"))
        .andExpect(status().isOk())
        .andExpect(content().string(containsString("mesh_bootstrap_state")))
        .andExpect(content().string(containsString("mesh_bootstrap_connect_attempts_total")))
        .andExpect(content().string(containsString("mesh_rpc_server_calls_total")))
        .andExpect(content().string(containsString("method=\"users.UserService/GetUser\"")))
        .andExpect(content().string(containsString("service=\"users-service\"")));
  }

  @Test
  void healthEndpointAnswersWithoutDatabase() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }
}
