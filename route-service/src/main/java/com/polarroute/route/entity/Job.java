package com.polarroute.route.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One dispatch of a route calculation. The id doubles as the task id on the worker topic;
 * task state is never stored here, it is read live from the job state store.
 */
@Entity
@Table(name = "jobs",
        indexes = {
                @Index(name = "idx_job_route", columnList = "route_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Job {

    @Id
    private UUID id;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @ToString.Exclude
    @ManyToOne(optional = false)
    @JoinColumn(name = "route_id", nullable = false)
    private Route route;
}
