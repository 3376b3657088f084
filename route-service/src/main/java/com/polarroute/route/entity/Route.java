package com.polarroute.route.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "routes",
        indexes = {
                @Index(name = "idx_route_mesh", columnList = "mesh_id"),
                @Index(name = "idx_route_requested", columnList = "requested_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Route {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreationTimestamp
    @Column(name = "requested_at", updatable = false)
    private Instant requestedAt;

    /** Set at the unsmoothed checkpoint, refreshed when smoothing completes. */
    @Column(name = "calculated_at")
    private Instant calculatedAt;

    private String file;

    /** Failure description written by the calculation worker. */
    @Column(columnDefinition = "TEXT")
    private String info;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "mesh_id")
    private Mesh mesh;

    @Column(name = "start_lat", nullable = false)
    private double startLat;

    @Column(name = "start_lon", nullable = false)
    private double startLon;

    @Column(name = "end_lat", nullable = false)
    private double endLat;

    @Column(name = "end_lon", nullable = false)
    private double endLon;

    @Column(name = "start_name")
    private String startName;

    @Column(name = "end_name")
    private String endName;

    @ToString.Exclude
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "json_unsmoothed")
    private Map<String, Object> jsonUnsmoothed;

    @ToString.Exclude
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "route_json")
    private Map<String, Object> json;

    @Column(name = "polar_route_version")
    private String polarRouteVersion;

    public boolean isResolved() {
        return calculatedAt != null && json != null;
    }

    /** Unsmoothed geometry stored but smoothing never completed. */
    public boolean isCheckpoint() {
        return jsonUnsmoothed != null && json == null;
    }

    public boolean hasEndpoints(double startLat, double startLon, double endLat, double endLon) {
        return Double.compare(this.startLat, startLat) == 0
                && Double.compare(this.startLon, startLon) == 0
                && Double.compare(this.endLat, endLat) == 0
                && Double.compare(this.endLon, endLon) == 0;
    }
}
