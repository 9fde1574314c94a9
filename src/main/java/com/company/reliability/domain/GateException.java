package com.company.reliability.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GateException {
    public static final String ALLOW_ALWAYS = "always";

    private String team;
    private String allow;

    public boolean bypasses(String requestingTeam) {
        return requestingTeam != null
                && requestingTeam.equals(team)
                && ALLOW_ALWAYS.equals(allow);
    }
}
