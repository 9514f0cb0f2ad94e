/* (C)2026 */
package com.ammann.egress.rpc;

/**
 * Event bus addresses served by the egress handler. Every address is scoped by the egress id,
 * so exactly one handler in the system receives requests for a given egress.
 */
public final class RpcTopics {

    private RpcTopics() {}

    public static final String PREFIX = "egress.";
    public static final String UPDATE_STREAM = "update_stream";
    public static final String STOP_EGRESS = "stop_egress";

    public static String updateStream(String egressId) {
        return PREFIX + egressId + "." + UPDATE_STREAM;
    }

    public static String stopEgress(String egressId) {
        return PREFIX + egressId + "." + STOP_EGRESS;
    }
}
