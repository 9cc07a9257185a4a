/* (C)2026 */
package com.ammann.tlparser.health;

import static org.assertj.core.api.Assertions.assertThat;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LivenessCheck")
class LivenessCheckTest {

    @Test
    @DisplayName("should return UP status named alive")
    void shouldReturnUpStatus() {
        HealthCheckResponse response = new LivenessCheck().call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo(LivenessCheck.NAME);
        assertThat(response.getData())
                .hasValueSatisfying(data -> assertThat(data).containsEntry("service", "tlparser-service"));
    }
}
