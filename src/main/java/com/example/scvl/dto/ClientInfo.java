package com.example.scvl.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ClientInfo {
    private boolean bot;
    private boolean mobile;
    private String platform;
    private String os;
    private String browserName;
}
