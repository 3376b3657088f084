package com.polarroute.route.model;

public record ImportedMesh(Long id, String checksum, String name) {
}
