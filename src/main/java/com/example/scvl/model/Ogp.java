package com.example.scvl.model;

import jakarta.persistence.*;
import lombok.Data;

/**
 * Open Graph metadata attached to at most one page.
 */
@Data
@Entity
@Table(name = "ogps")
public class Ogp {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "page_id", nullable = false, unique = true, updatable = false)
    private Long pageId;

    private String title;

    @Column(columnDefinition = "TEXT")
    private String image;

    @Column(columnDefinition = "TEXT")
    private String description;
}
