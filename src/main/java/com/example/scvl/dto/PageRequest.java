package com.example.scvl.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of create and update calls. When {@code ogp} is false the OGP fields are ignored and any
 * existing OGP record of the page is removed on update.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageRequest {
    @NotBlank(message = "url cannot be empty")
    private String url;
    private boolean ogp;
    private String title;
    private String image;
    private String description;

    public static PageRequest of(String url) {
        return new PageRequest(url, false, null, null, null);
    }

    public static PageRequest withOgp(String url, String title, String image, String description) {
        return new PageRequest(url, true, title, image, description);
    }
}
