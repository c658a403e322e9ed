package com.jasmin.requestguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class BlockStatus {
    private String ip;
    private boolean blocked;
    private long blockTtlSeconds;
    private long violationCount;
}
