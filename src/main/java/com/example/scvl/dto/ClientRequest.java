package com.example.scvl.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Raw attributes of an inbound redirect request used for analytics.
 */
@Data
@AllArgsConstructor
public class ClientRequest {
    private String realIp;
    private String referer;
    private String userAgent;
}
