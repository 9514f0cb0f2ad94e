/* (C)2026 */
package com.ammann.egress.model;

import com.ammann.egress.enumeration.EgressStatus;
import java.time.Instant;
import java.util.List;

/**
 * Descriptor of the egress owned by this process.
 *
 * <p>The pipeline is the only writer while it runs. Fields are volatile so that readers on
 * other threads (RPC handlers, the run loop) observe the latest values without locking.
 * Everything handed across a thread or process boundary should be a {@link #snapshot()}.
 */
public class EgressInfo {

    private volatile String egressId;
    private volatile String roomName;
    private volatile List<String> outputs = List.of();
    private volatile EgressStatus status = EgressStatus.EGRESS_STARTING;
    private volatile Instant startedAt;
    private volatile Instant updatedAt;
    private volatile Instant endedAt;
    private volatile String error;

    public EgressInfo() {}

    public EgressInfo(String egressId, String roomName, List<String> outputs) {
        this.egressId = egressId;
        this.roomName = roomName;
        this.outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    /**
     * Moves to {@code status} and stamps {@code updatedAt}. Terminal statuses also stamp
     * {@code endedAt}.
     */
    public void transition(EgressStatus status, Instant now) {
        this.status = status;
        this.updatedAt = now;
        if (status == EgressStatus.EGRESS_ACTIVE && startedAt == null) {
            this.startedAt = now;
        }
        if (status.isTerminal()) {
            this.endedAt = now;
        }
    }

    /**
     * Marks the egress as failed at {@code now}. When it never started, {@code startedAt} is
     * set to the same instant so that {@code endedAt >= startedAt} holds.
     */
    public void fail(String error, Instant now) {
        if (startedAt == null) {
            this.startedAt = now;
        }
        this.error = error;
        transition(EgressStatus.EGRESS_FAILED, now);
    }

    public EgressInfo snapshot() {
        EgressInfo copy = new EgressInfo(egressId, roomName, outputs);
        copy.status = status;
        copy.startedAt = startedAt;
        copy.updatedAt = updatedAt;
        copy.endedAt = endedAt;
        copy.error = error;
        return copy;
    }

    public String getEgressId() {
        return egressId;
    }

    public void setEgressId(String egressId) {
        this.egressId = egressId;
    }

    public String getRoomName() {
        return roomName;
    }

    public void setRoomName(String roomName) {
        this.roomName = roomName;
    }

    public List<String> getOutputs() {
        return outputs;
    }

    public void setOutputs(List<String> outputs) {
        this.outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public EgressStatus getStatus() {
        return status;
    }

    public void setStatus(EgressStatus status) {
        this.status = status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(Instant endedAt) {
        this.endedAt = endedAt;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return "EgressInfo{egressId=" + egressId + ", status=" + status + ", error=" + error + "}";
    }
}
