package com.example.scvl.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AuthResponse {
    private Long user_id;
    private String name;
    private String email;
    private String token;
}
