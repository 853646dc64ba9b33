package com.yerin.collector.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "annotation", indexes = @Index(name = "ix_annotation_dataset", columnList = "dataset_key, label"))
public class Annotation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dataset_key", nullable = false, length = 64)
    private String datasetKey;

    @Column(name = "item_id", nullable = false, length = 255)
    private String itemId;

    @Column(nullable = false, length = 100)
    private String label;

    @Column(name = "annotation_value", columnDefinition = "text")
    private String value;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() { if (createdAt == null) createdAt = Instant.now(); }
}
