package com.phillippitts.linkband.presentation.controller;

import com.phillippitts.linkband.exception.TransportException;
import com.phillippitts.linkband.protocol.SensorType;
import com.phillippitts.linkband.service.gate.RecordingDecision;
import com.phillippitts.linkband.service.monitor.Alert;
import com.phillippitts.linkband.service.monitor.ConnectionMetrics;
import com.phillippitts.linkband.service.monitor.ConnectionStatus;
import com.phillippitts.linkband.service.supervisor.BridgeSupervisor;
import com.phillippitts.linkband.service.supervisor.SupervisorDebugInfo;
import com.phillippitts.linkband.service.transport.TransportState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-mostly view of the bridge supervisor, plus the few commands a UI needs.
 */
@RestController
@RequestMapping("/supervisor")
class SupervisorStatusController {

    private static final Logger LOG = LogManager.getLogger(SupervisorStatusController.class);

    private final BridgeSupervisor supervisor;

    SupervisorStatusController(BridgeSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping("/status")
    ResponseEntity<StatusResponse> status() {
        return ResponseEntity.ok(new StatusResponse(
                supervisor.getOverallStatus().wireName(),
                supervisor.currentStatus(),
                supervisor.streamingState().phase().name(),
                supervisor.transportState(),
                supervisor.getMetrics()));
    }

    @GetMapping("/recording-gate")
    ResponseEntity<RecordingDecision> recordingGate() {
        return ResponseEntity.ok(supervisor.canRecord());
    }

    @GetMapping("/debug")
    ResponseEntity<SupervisorDebugInfo> debug() {
        return ResponseEntity.ok(supervisor.getDebugInfo());
    }

    @GetMapping("/alerts")
    ResponseEntity<List<Alert>> alerts() {
        return ResponseEntity.ok(supervisor.getAlerts());
    }

    @GetMapping("/history")
    ResponseEntity<List<ConnectionStatus>> history(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(supervisor.getStatusHistory(limit));
    }

    @PostMapping("/connect")
    ResponseEntity<Map<String, Object>> connect() {
        LOG.info("Manual connect requested");
        supervisor.connect();
        return accepted("connect");
    }

    @PostMapping("/disconnect")
    ResponseEntity<Map<String, Object>> disconnect() {
        LOG.info("Manual disconnect requested");
        supervisor.disconnect();
        return accepted("disconnect");
    }

    /**
     * Forwards a start/stop request to the bridge. Observed streaming follows only once data
     * flows.
     */
    @PostMapping("/streaming")
    ResponseEntity<Map<String, Object>> streaming(@RequestParam boolean enabled) {
        TransportState state = supervisor.transportState();
        if (state != TransportState.CONNECTED) {
            throw new TransportException("Cannot request streaming while " + state);
        }
        supervisor.requestStreaming(enabled);
        return accepted(enabled ? "start_streaming" : "stop_streaming");
    }

    /**
     * Replaces the required sensors. Body: wire names, e.g. {@code ["eeg","ppg"]}.
     */
    @PutMapping("/required-sensors")
    ResponseEntity<Map<String, Object>> requiredSensors(@RequestBody List<String> sensors) {
        Set<SensorType> required = EnumSet.noneOf(SensorType.class);
        for (String name : sensors) {
            required.add(SensorType.fromWire(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown sensor: " + name)));
        }
        supervisor.setRequiredSensors(required);
        return accepted("required_sensors");
    }

    private static ResponseEntity<Map<String, Object>> accepted(String command) {
        return ResponseEntity.accepted().body(Map.of("accepted", command));
    }

    record StatusResponse(
            String overall,
            ConnectionStatus current,
            String streamingPhase,
            TransportState transport,
            ConnectionMetrics metrics
    ) {}
}
