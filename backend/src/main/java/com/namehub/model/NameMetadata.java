package com.namehub.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "name_metadata")
public class NameMetadata {

    @Id
    @Column(nullable = false, updatable = false, length = 64)
    private String name;

    @Column(nullable = false, length = 256)
    private String title;

    @Column(length = 4000)
    private String description;

    @Column(length = 1024)
    private String image;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
