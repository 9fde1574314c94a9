package com.company.reliability.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CorrelationWindow {
    @Builder.Default
    int beforeMinutes = 30;
    @Builder.Default
    int afterMinutes = 120;
    @Builder.Default
    int detectionStepMinutes = 10;
    @Builder.Default
    int historyLookbackHours = 168;

    public static CorrelationWindow defaults() {
        return CorrelationWindow.builder().build();
    }
}
