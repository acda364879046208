package com.example.scvl.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageResponse {
    private Long id;
    private String slug;
    private String url;
    @JsonProperty("short")
    private String shortUrl;
    @JsonProperty("created_at")
    private Long createdAt;
    private OgpResponse ogp;
    private Long views;

    @Data
    public static class OgpResponse {
        private String title;
        private String image;
        private String description;
    }
}
