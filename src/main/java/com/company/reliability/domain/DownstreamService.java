package com.company.reliability.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownstreamService {
    private String name;
    private String criticality;

    public boolean isHighCriticality() {
        return criticality != null
                && ("critical".equalsIgnoreCase(criticality) || "high".equalsIgnoreCase(criticality));
    }
}
