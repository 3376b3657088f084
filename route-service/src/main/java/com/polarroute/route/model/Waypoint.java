package com.polarroute.route.model;

public record Waypoint(String name, double lat, double lon) {

    public static final String START = "Start";
    public static final String END = "End";
}
