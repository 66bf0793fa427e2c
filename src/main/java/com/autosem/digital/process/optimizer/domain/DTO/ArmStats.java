package com.autosem.digital.process.optimizer.domain.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArmStats {
    private long impressions;
    private long clicks;
    private double ctr;
}
