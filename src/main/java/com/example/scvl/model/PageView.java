package com.example.scvl.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Data
@Entity
@Table(name = "page_views", indexes = @Index(name = "idx_page_views_slug", columnList = "slug"))
public class PageView {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 16)
    private String slug;

    @Column(name = "real_ip")
    private String realIp;

    @Column(columnDefinition = "TEXT")
    private String referer;

    private boolean mobile;

    private String platform;

    private String os;

    @Column(name = "browser_name")
    private String browserName;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
