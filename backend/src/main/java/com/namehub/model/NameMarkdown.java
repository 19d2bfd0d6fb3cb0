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
@Table(name = "name_markdown")
public class NameMarkdown {

    @Id
    @Column(nullable = false, updatable = false, length = 64)
    private String name;

    @Column(nullable = false, length = 20000)
    private String content;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
