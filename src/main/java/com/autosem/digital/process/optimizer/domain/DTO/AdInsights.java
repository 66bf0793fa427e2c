package com.autosem.digital.process.optimizer.domain.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdInsights {
    private long impressions;
    private long clicks;

    public static AdInsights empty() {
        return new AdInsights(0, 0);
    }
}
