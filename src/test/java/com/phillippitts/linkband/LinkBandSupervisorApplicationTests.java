package com.phillippitts.linkband;

import com.phillippitts.linkband.service.monitor.OverallStatus;
import com.phillippitts.linkband.service.supervisor.BridgeSupervisor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "linkband.supervisor.auto-start=false" // no bridge in tests
    }
)
class LinkBandSupervisorApplicationTests {

    @Autowired
    private BridgeSupervisor supervisor;

    @Test
    void contextLoads() {
        assertThat(supervisor.isRunning()).isFalse();
        assertThat(supervisor.getOverallStatus()).isEqualTo(OverallStatus.OFFLINE);
    }

}
