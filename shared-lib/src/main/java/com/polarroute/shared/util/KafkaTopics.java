package com.polarroute.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String ROUTE_CALCULATION_REQUESTED = "route.calculation.requested";
}
