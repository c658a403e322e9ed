package com.jasmin.requestguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class GuardErrorResponse {
    private String error;
    private String detail;
}
