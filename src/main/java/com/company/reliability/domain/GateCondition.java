package com.company.reliability.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ordered override of the blocking threshold, applied when {@code when}
 * evaluates true. A null {@code blocking} removes blocking for that match.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GateCondition {
    private String name;
    private String when;
    private Double blocking;
}
