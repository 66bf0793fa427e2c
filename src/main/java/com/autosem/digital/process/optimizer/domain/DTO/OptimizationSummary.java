package com.autosem.digital.process.optimizer.domain.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationSummary {
    private long totalCampaigns;
    private long active;
    private double totalSpend;
    private double totalRevenue;
    private double overallRoas;
}
